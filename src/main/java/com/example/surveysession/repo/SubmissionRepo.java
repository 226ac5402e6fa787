package com.example.surveysession.repo;

import com.example.surveysession.model.Submission;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SubmissionRepo extends MongoRepository<Submission, String> {}
