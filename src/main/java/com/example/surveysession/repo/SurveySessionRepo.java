package com.example.surveysession.repo;

import com.example.surveysession.model.SessionStatus;
import com.example.surveysession.model.SurveySession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface SurveySessionRepo extends MongoRepository<SurveySession, String> {
    long countByStatus(SessionStatus status);
    List<SurveySession> findByStatusAndLastActivityBefore(SessionStatus status, Instant cutoff, Pageable page);
    List<SurveySession> findByStatusInAndLastActivityBefore(Collection<SessionStatus> statuses, Instant cutoff, Pageable page);
}
