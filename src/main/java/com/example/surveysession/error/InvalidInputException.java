package com.example.surveysession.error;

public class InvalidInputException extends SurveySessionException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
