package com.example.surveysession.controller;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CreateSessionRequest {
    private String deviceType;
    private String browser;
}
