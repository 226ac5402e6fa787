package com.example.surveysession.error;

/**
 * No active session exists for the identifier. Terminal and absent sessions
 * are reported the same way.
 */
public class SessionNotFoundException extends SurveySessionException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.NOT_FOUND, "Session not found or expired: " + sessionId);
    }
}
