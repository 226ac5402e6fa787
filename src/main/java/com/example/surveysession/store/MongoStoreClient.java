package com.example.surveysession.store;

import com.example.surveysession.model.SessionStatus;
import com.example.surveysession.model.Submission;
import com.example.surveysession.model.SurveySession;
import com.example.surveysession.repo.SubmissionRepo;
import com.example.surveysession.repo.SurveySessionRepo;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Component
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    private final MongoTemplate mongo;
    private final SurveySessionRepo sessionRepo;
    private final SubmissionRepo submissionRepo;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo, SurveySessionRepo sessionRepo, SubmissionRepo submissionRepo) {
        this.mongo = mongo;
        this.sessionRepo = sessionRepo;
        this.submissionRepo = submissionRepo;
    }

    @Override
    public SurveySession insertSession(SurveySession session) {
        return mongo.insert(session);
    }

    @Override
    public Optional<SurveySession> findSession(String sessionId) {
        return sessionRepo.findById(sessionId);
    }

    @Override
    public SurveySession saveSession(SurveySession session) {
        // MongoTemplate.save honours @Version and throws OptimisticLockingFailureException on a stale version
        return mongo.save(session);
    }

    @Override
    public boolean deleteSession(String sessionId, Long expectedVersion) {
        Criteria criteria = Criteria.where("_id").is(sessionId);
        if (expectedVersion != null) {
            criteria = criteria.and("version").is(expectedVersion);
        }
        long deleted = mongo.remove(Query.query(criteria), SurveySession.class).getDeletedCount();
        return deleted > 0;
    }

    @Override
    public Submission insertSubmissionIfAbsent(Submission submission) {
        try {
            return mongo.insert(submission);
        } catch (DuplicateKeyException e) {
            logger.info("Submission {} already finalized for session {}, reusing it",
                    submission.getSubmissionId(), submission.getSessionId());
            return submissionRepo.findById(submission.getSubmissionId())
                    .orElseThrow(() -> e);
        }
    }

    @Override
    public List<SurveySession> findByStatusInactiveSince(SessionStatus status, Instant cutoff, int limit) {
        return sessionRepo.findByStatusAndLastActivityBefore(status, cutoff, PageRequest.of(0, limit));
    }

    @Override
    public List<SurveySession> findTerminalInactiveSince(Instant cutoff, int limit) {
        return sessionRepo.findByStatusInAndLastActivityBefore(
                EnumSet.of(SessionStatus.COMPLETED, SessionStatus.EXPIRED, SessionStatus.ABANDONED),
                cutoff, PageRequest.of(0, limit));
    }

    @Override
    public List<SurveySession> findRecentSessions(int limit) {
        return sessionRepo.findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "createdAt"))).getContent();
    }

    @Override
    public long countByStatus(SessionStatus status) {
        return sessionRepo.countByStatus(status);
    }

    @Override
    public long countSubmissions() {
        return submissionRepo.count();
    }

    @Override
    public void ping() {
        mongo.executeCommand(new Document("ping", 1));
    }
}
