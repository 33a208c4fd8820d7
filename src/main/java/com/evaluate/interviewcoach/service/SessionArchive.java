package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.SessionView;

import java.util.Optional;

/** Receives every session once it reaches a terminal state and serves it back afterwards. */
public interface SessionArchive {

    /**
     * @return true when the snapshot was stored and can be read back with {@link #find}
     */
    boolean archive(SessionView session);

    Optional<SessionView> find(String sessionId);
}
