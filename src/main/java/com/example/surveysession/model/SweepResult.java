package com.example.surveysession.model;

import lombok.Value;

@Value
public class SweepResult {
    int expired;
    int purged;
}
