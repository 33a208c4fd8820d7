package com.evaluate.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of an interview session. This is also the archived JSON shape, so
 * property names are part of the persisted format.
 */
@Value
@Builder
@Jacksonized
public class SessionView {
    String id;
    InterviewType interviewType;
    SessionState state;
    List<Question> questions;
    /** Keyed by question id, in answering order. */
    Map<String, Answer> answers;
    int currentIndex;
    boolean adaptive;
    /** Gap analysis the session was started from, kept so an archived session can be finalized. */
    List<GapEntry> gaps;
    String abortReason;
    Instant createdAt;
    Instant completedAt;

    @JsonIgnore
    public Optional<Question> currentQuestion() {
        if (state != SessionState.AWAITING_ANSWER || currentIndex >= questions.size()) {
            return Optional.empty();
        }
        return Optional.of(questions.get(currentIndex));
    }
}
