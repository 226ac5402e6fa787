package com.example.surveysession.audit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rates an HTTP exchange. Every applicable rule is evaluated and the most
 * severe level wins.
 */
@Component
public class RiskAssessor {

    private final long slowResponseMs;

    public RiskAssessor(@Value("${app.audit.slow-response-ms:10000}") long slowResponseMs) {
        this.slowResponseMs = slowResponseMs;
    }

    public RiskLevel assess(String method, String path, int status, long latencyMs) {
        RiskLevel risk = RiskLevel.LOW;
        if ("DELETE".equalsIgnoreCase(method)) {
            risk = RiskLevel.max(risk, RiskLevel.MEDIUM);
        }
        if (status >= 500) {
            risk = RiskLevel.max(risk, RiskLevel.HIGH);
        }
        if (latencyMs > slowResponseMs) {
            risk = RiskLevel.max(risk, RiskLevel.HIGH);
        }
        if (isMutation(method) && path != null && path.contains("/admin")) {
            risk = RiskLevel.max(risk, RiskLevel.HIGH);
        }
        return risk;
    }

    public static boolean isMutation(String method) {
        if (method == null) {
            return false;
        }
        switch (method.toUpperCase()) {
            case "POST":
            case "PUT":
            case "PATCH":
            case "DELETE":
                return true;
            default:
                return false;
        }
    }
}
