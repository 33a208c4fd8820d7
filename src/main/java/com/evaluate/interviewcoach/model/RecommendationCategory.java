package com.evaluate.interviewcoach.model;

/**
 * Declaration order is precedence order: when one resource is reached through several
 * routes the earliest category wins.
 */
public enum RecommendationCategory {
    PRIORITY,
    SKILL_DEVELOPMENT,
    INTERVIEW_PREP,
    ADDITIONAL
}
