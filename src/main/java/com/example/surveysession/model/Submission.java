package com.example.surveysession.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Finalized survey response. Written once, never updated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("submissions")
public class Submission {
    @Id
    private String submissionId;
    @Indexed(unique = true)
    private String sessionId;
    private SurveyAnswers answers;
    private ClientMetadata metadata;
    private Instant sessionCreatedAt;
    @Indexed
    private Instant submittedAt;

    /**
     * Submission id for a session. Name-based, so finalizing the same session
     * again always targets the same record.
     */
    public static String idFor(String sessionId) {
        return UUID.nameUUIDFromBytes(("submission:" + sessionId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
