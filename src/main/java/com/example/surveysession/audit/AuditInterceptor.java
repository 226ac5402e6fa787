package com.example.surveysession.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audits every mutating request that reaches a handler.
 */
@Component
public class AuditInterceptor implements HandlerInterceptor {

    private static final String START_ATTRIBUTE = AuditInterceptor.class.getName() + ".start";

    private final AuditTrail auditTrail;
    private final RiskAssessor riskAssessor;

    public AuditInterceptor(AuditTrail auditTrail, RiskAssessor riskAssessor) {
        this.auditTrail = auditTrail;
        this.riskAssessor = riskAssessor;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        String method = request.getMethod();
        if (!RiskAssessor.isMutation(method)) {
            return;
        }
        Object start = request.getAttribute(START_ATTRIBUTE);
        long latencyMs = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000 : 0;
        int status = response.getStatus();
        if (ex != null && status < 500) {
            status = 500;
        }
        String path = request.getRequestURI();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", method);
        details.put("url", path);
        details.put("statusCode", status);
        details.put("responseTimeMs", latencyMs);
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        details.put("userAgent", userAgent == null ? "unknown" : userAgent);

        auditTrail.logEvent(AuditEntry.builder()
                .level(status >= 500 ? AuditLevel.ERROR : status >= 400 ? AuditLevel.WARNING : AuditLevel.INFO)
                .category(AuditCategory.DATA_MODIFICATION)
                .action(method + " " + path)
                .resource(path)
                .actor("anonymous")
                .networkOrigin(request.getRemoteAddr())
                .outcome(status < 400 ? AuditOutcome.SUCCESS : AuditOutcome.FAILURE)
                .risk(riskAssessor.assess(method, path, status, latencyMs))
                .details(details)
                .build());
    }
}
