package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.SessionState;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.service.generation.PriorExchange;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable session state. Only {@link SessionEngine} touches it, always while holding the
 * session's monitor.
 */
@Getter
class InterviewSession {

    private final String id;
    private final InterviewType type;
    private final CandidateProfile profile;
    private final JobRequirement requirement;
    private final List<GapEntry> gaps;
    private final boolean adaptive;
    private final Instant createdAt = Instant.now();

    private final List<Question> questions = new ArrayList<>();
    private final Map<String, Answer> answers = new LinkedHashMap<>();
    private SessionState state = SessionState.CREATED;
    private int currentIndex = 0;
    private String abortReason;
    private Instant completedAt;
    /** Identifies the evaluation in flight; a result carrying an older ticket is stale. */
    private long evaluationTicket = 0;

    InterviewSession(String id, InterviewType type, CandidateProfile profile, JobRequirement requirement,
                     List<GapEntry> gaps, boolean adaptive) {
        this.id = id;
        this.type = type;
        this.profile = profile;
        this.requirement = requirement;
        this.gaps = List.copyOf(gaps);
        this.adaptive = adaptive;
    }

    void begin(List<Question> initialQuestions) {
        questions.addAll(initialQuestions);
        state = SessionState.AWAITING_ANSWER;
    }

    Question currentQuestion() {
        return questions.get(currentIndex);
    }

    long beginEvaluation(Answer pending) {
        answers.put(pending.getQuestionId(), pending);
        state = SessionState.EVALUATING;
        return ++evaluationTicket;
    }

    boolean isEvaluationCurrent(long ticket) {
        return state == SessionState.EVALUATING && ticket == evaluationTicket;
    }

    void withdraw(String questionId) {
        answers.remove(questionId);
        state = SessionState.AWAITING_ANSWER;
    }

    void completeEvaluation(String questionId, Evaluation evaluation, Question followUp) {
        answers.computeIfPresent(questionId, (id, answer) -> answer.toBuilder().evaluation(evaluation).build());
        if (followUp != null) {
            questions.add(currentIndex + 1, followUp);
        }
        currentIndex++;
        if (currentIndex == questions.size()) {
            state = SessionState.COMPLETED;
            completedAt = Instant.now();
        } else {
            state = SessionState.AWAITING_ANSWER;
        }
    }

    /** Evaluated exchanges in asking order. */
    List<PriorExchange> answeredSoFar() {
        List<PriorExchange> exchanges = new ArrayList<>();
        for (Question question : questions) {
            Answer answer = answers.get(question.getId());
            if (answer != null && answer.isEvaluated()) {
                exchanges.add(new PriorExchange(question, answer));
            }
        }
        return List.copyOf(exchanges);
    }

    boolean hasFollowUpFor(String questionId) {
        return questions.stream().anyMatch(q -> questionId.equals(q.getFollowUpOf()));
    }

    void abort(String reason) {
        state = SessionState.ABORTED;
        abortReason = reason;
        completedAt = Instant.now();
    }

    SessionView view() {
        return SessionView.builder()
                .id(id)
                .interviewType(type)
                .state(state)
                .questions(List.copyOf(questions))
                .answers(new LinkedHashMap<>(answers))
                .currentIndex(currentIndex)
                .adaptive(adaptive)
                .gaps(gaps)
                .abortReason(abortReason)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .build();
    }
}
