package com.example.surveysession.controller;

import com.example.surveysession.model.ClientMetadata;
import com.example.surveysession.model.SessionSnapshot;
import com.example.surveysession.model.SessionStats;
import com.example.surveysession.model.SubmissionReceipt;
import com.example.surveysession.service.SessionLifecycleManager;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final String UNKNOWN = "unknown";

    private final SessionLifecycleManager sessions;

    public SessionController(SessionLifecycleManager sessions) {
        this.sessions = sessions;
    }

    @PostMapping("/create")
    public ResponseEntity<ApiResponse<Map<String, Object>>> create(
            @RequestBody(required = false) CreateSessionRequest body, HttpServletRequest request) {
        CreateSessionRequest req = body == null ? new CreateSessionRequest() : body;
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        ClientMetadata metadata = ClientMetadata.builder()
                .ipAddress(request.getRemoteAddr())
                .userAgent(userAgent == null ? UNKNOWN : userAgent)
                .deviceType(req.getDeviceType() == null ? UNKNOWN : req.getDeviceType())
                .browser(req.getBrowser() == null ? UNKNOWN : req.getBrowser())
                .build();

        SessionSnapshot session = sessions.createSession(metadata);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", session.getSessionId());
        data.put("currentPage", session.getCurrentPage());
        data.put("totalPages", session.getTotalPages());
        data.put("createdAt", session.getCreatedAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Session created successfully", data));
    }

    @PutMapping("/{sessionId}/save-progress")
    public ResponseEntity<ApiResponse<Map<String, Object>>> saveProgress(@PathVariable String sessionId,
                                                                         @RequestBody ProgressRequest body) {
        SessionSnapshot session = sessions.saveProgress(sessionId, body.getPage(), body.getData());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("currentPage", session.getCurrentPage());
        data.put("lastActivity", session.getLastActivity());
        return ResponseEntity.ok(ApiResponse.ok("Progress saved successfully", data));
    }

    @GetMapping("/{sessionId}/status")
    public ResponseEntity<ApiResponse<SessionSnapshot>> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(sessions.getStatus(sessionId)));
    }

    @PostMapping("/{sessionId}/submit")
    public ResponseEntity<ApiResponse<SubmissionReceipt>> submit(@PathVariable String sessionId) {
        SubmissionReceipt receipt = sessions.submit(sessionId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Survey submitted successfully", receipt));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> abandon(@PathVariable String sessionId) {
        sessions.abandon(sessionId);
        return ResponseEntity.ok(ApiResponse.ok("Session abandoned", null));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<SessionStats>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(sessions.stats()));
    }
}
