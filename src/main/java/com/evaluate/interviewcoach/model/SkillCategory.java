package com.evaluate.interviewcoach.model;

public enum SkillCategory {
    TECHNICAL,
    BEHAVIORAL,
    DOMAIN
}
