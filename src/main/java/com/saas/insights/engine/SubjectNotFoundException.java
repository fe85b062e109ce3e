package com.saas.insights.engine;

public class SubjectNotFoundException extends RuntimeException {

    private final String subjectId;

    public SubjectNotFoundException(String subjectId) {
        super("No activity record for subject " + subjectId);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
