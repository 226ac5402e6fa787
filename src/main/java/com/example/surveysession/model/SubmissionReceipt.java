package com.example.surveysession.model;

import lombok.Value;

import java.time.Instant;

@Value
public class SubmissionReceipt {
    String sessionId;
    String submissionId;
    Instant submittedAt;
}
