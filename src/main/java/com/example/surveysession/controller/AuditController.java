package com.example.surveysession.controller;

import com.example.surveysession.audit.AuditEntry;
import com.example.surveysession.audit.AuditStats;
import com.example.surveysession.audit.AuditTrail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the audit trail.
 */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditTrail auditTrail;

    public AuditController(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<AuditStats>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(auditTrail.stats()));
    }

    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<AuditEntry>>> search(@RequestParam("q") String query) {
        return ResponseEntity.ok(ApiResponse.ok(auditTrail.search(query)));
    }

    @GetMapping("/high-risk")
    public ResponseEntity<ApiResponse<List<AuditEntry>>> highRisk() {
        return ResponseEntity.ok(ApiResponse.ok(auditTrail.recentHighRisk()));
    }
}
