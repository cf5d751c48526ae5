package com.cardiacreport.exception;

public class StudyNotFoundException extends RuntimeException {

    public StudyNotFoundException(String studyId) {
        super("Study not found: " + studyId);
    }
}
