package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.SessionSnapshot;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.repository.SessionSnapshotRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Stores terminal sessions as JSON snapshots. A storage failure is logged and does not undo
 * the transition that triggered it; the caller keeps the session in memory instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JpaSessionArchive implements SessionArchive {

    private final SessionSnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;

    @Override
    public boolean archive(SessionView session) {
        try {
            SessionSnapshot snapshot = new SessionSnapshot();
            snapshot.setSessionId(session.getId());
            snapshot.setInterviewType(session.getInterviewType().name());
            snapshot.setState(session.getState().name());
            snapshot.setMeanScore(meanScore(session));
            snapshot.setPayload(objectMapper.writeValueAsString(session));
            snapshotRepository.save(snapshot);
            log.info("Archived session {} ({})", session.getId(), session.getState());
            return true;
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Failed to archive session {}", session.getId(), e);
            return false;
        }
    }

    @Override
    public Optional<SessionView> find(String sessionId) {
        return snapshotRepository.findById(sessionId).map(this::read);
    }

    private SessionView read(SessionSnapshot snapshot) {
        try {
            return objectMapper.readValue(snapshot.getPayload(), SessionView.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt snapshot for session " + snapshot.getSessionId(), e);
        }
    }

    private static Double meanScore(SessionView session) {
        OptionalDouble mean = session.getAnswers().values().stream()
                .filter(Answer::isEvaluated)
                .mapToDouble(a -> a.getEvaluation().getScore())
                .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }
}
