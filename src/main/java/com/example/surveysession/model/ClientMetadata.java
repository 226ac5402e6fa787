package com.example.surveysession.model;

import lombok.*;

/**
 * Client fingerprint captured once, when the session is created.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientMetadata {
    private String ipAddress;
    private String userAgent;
    private String deviceType;
    private String browser;
}
