package com.example.surveysession.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAuditAlertSink implements AuditAlertSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAuditAlertSink.class);

    @Override
    public void alert(AuditEntry entry) {
        logger.warn("High-risk audit event: action={}, resource={}, actor={}, origin={}, risk={}, level={}, details={}",
                entry.getAction(), entry.getResource(), entry.getActor(), entry.getNetworkOrigin(),
                entry.getRisk(), entry.getLevel(), entry.getDetails());
    }
}
