package com.evaluate.interviewcoach.model;

import com.evaluate.interviewcoach.exception.InvalidConfigurationException;

import java.util.Locale;

public enum InterviewType {
    TECHNICAL("Technical"),
    BEHAVIORAL("Behavioral"),
    COMPETENCY("Competency Based"),
    GENERAL("General");

    private final String label;

    InterviewType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Technical and competency interviews are built around the candidate's skill gaps,
     * the other types can run on generic templates alone.
     */
    public boolean isGapDriven() {
        return this == TECHNICAL || this == COMPETENCY;
    }

    public static InterviewType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("Interview type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
        return switch (normalized) {
            case "technical" -> TECHNICAL;
            case "behavioral", "behavioural" -> BEHAVIORAL;
            case "competency", "competency based" -> COMPETENCY;
            case "general" -> GENERAL;
            default -> throw new InvalidConfigurationException("Unsupported interview type: " + value);
        };
    }
}
