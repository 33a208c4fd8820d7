package com.evaluate.interviewcoach.model;

public enum EducationLevel {
    UNKNOWN,
    HIGH_SCHOOL,
    ASSOCIATE,
    BACHELOR,
    MASTER,
    DOCTORATE
}
