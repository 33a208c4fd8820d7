package com.evaluate.interviewcoach.model;

public enum Importance {
    MUST_HAVE,
    NICE_TO_HAVE
}
