package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.exception.EvaluationFailureException;
import com.evaluate.interviewcoach.exception.InsufficientContextException;
import com.evaluate.interviewcoach.exception.InterviewCoachException;
import com.evaluate.interviewcoach.exception.InvalidConfigurationException;
import com.evaluate.interviewcoach.exception.InvalidStateException;
import com.evaluate.interviewcoach.exception.NotCompletedException;
import com.evaluate.interviewcoach.exception.OutOfOrderSubmissionException;
import com.evaluate.interviewcoach.exception.SessionNotFoundException;
import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.AnswerDimension;
import com.evaluate.interviewcoach.model.AnswerOutcome;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.QuestionScore;
import com.evaluate.interviewcoach.model.SessionState;
import com.evaluate.interviewcoach.model.SessionSummary;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.model.WeakArea;
import com.evaluate.interviewcoach.service.evaluation.AnswerEvaluator;
import com.evaluate.interviewcoach.service.generation.GenerationContext;
import com.evaluate.interviewcoach.service.generation.QuestionGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns interview sessions and drives them through
 * {@code CREATED -> AWAITING_ANSWER -> EVALUATING -> AWAITING_ANSWER ... -> COMPLETED},
 * with {@code ABORTED} reachable from any non-terminal state.
 *
 * <p>Transitions of one session are serialized on the session's monitor. The evaluator and
 * the follow-up generator run outside the monitor, so {@link #abort} stays callable while an
 * evaluation is in flight; a result that arrives after the abort is discarded. Different
 * sessions share nothing mutable.
 *
 * <p>Only live sessions are held in memory. A session that reaches a terminal state is handed
 * to the {@link SessionArchive} and released; later reads and finalization are served from the
 * archived snapshot. A session whose snapshot could not be stored stays in memory.
 */
@Service
@Slf4j
public class SessionEngine {

    private final QuestionGenerator questionGenerator;
    private final AnswerEvaluator answerEvaluator;
    private final GapAnalyzer gapAnalyzer;
    private final InterviewProperties.Session settings;
    private final SessionArchive archive;
    private final Executor evaluationExecutor;

    private final Map<String, InterviewSession> sessions = new ConcurrentHashMap<>();

    public SessionEngine(QuestionGenerator questionGenerator,
                         AnswerEvaluator answerEvaluator,
                         GapAnalyzer gapAnalyzer,
                         InterviewProperties properties,
                         SessionArchive archive,
                         @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        this.questionGenerator = questionGenerator;
        this.answerEvaluator = answerEvaluator;
        this.gapAnalyzer = gapAnalyzer;
        this.settings = properties.getSession();
        this.archive = archive;
        this.evaluationExecutor = evaluationExecutor;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────────

    public SessionView start(InterviewType type, CandidateProfile candidate, JobRequirement requirement) {
        return start(type, candidate, requirement, settings.isAdaptive());
    }

    public SessionView start(InterviewType type, CandidateProfile candidate, JobRequirement requirement,
                             boolean adaptive) {
        if (type == null) {
            throw new InvalidConfigurationException("Interview type is required");
        }
        if (candidate == null || requirement == null) {
            throw new InvalidConfigurationException("A candidate profile and a job requirement are required");
        }

        List<GapEntry> gaps = gapAnalyzer.analyze(candidate, requirement);
        List<GapEntry> seeds = type.isGapDriven()
                ? gaps.stream().limit(Math.max(0, settings.getSeedGaps())).toList()
                : List.of();

        InterviewSession session = new InterviewSession(UUID.randomUUID().toString(), type, candidate,
                requirement, gaps, adaptive);
        log.info("Session {} created: type={}, adaptive={}, seeded by {} gap entries",
                session.getId(), type, adaptive, seeds.size());

        List<Question> questions = questionGenerator.generate(GenerationContext.builder()
                .type(type)
                .candidate(candidate)
                .requirement(requirement)
                .gaps(seeds)
                .questionCount(settings.getQuestionsPerSession())
                .seed(settings.getRandomSeed())
                .build());
        if (questions.isEmpty()) {
            throw new InsufficientContextException("No questions could be generated for a " + type.getLabel() + " interview");
        }
        requireDistinctIds(questions);

        SessionView view;
        synchronized (session) {
            session.begin(questions);
            view = session.view();
        }
        sessions.put(session.getId(), session);
        log.info("Session {} awaiting answer to {} of {} questions",
                session.getId(), questions.get(0).getId(), questions.size());
        return view;
    }

    public AnswerOutcome submitAnswer(String sessionId, String questionId, String rawText) {
        return submitAnswer(sessionId, questionId, rawText, settings.getEvaluationTimeout());
    }

    /**
     * Accepts the answer to the current question, evaluates it and advances the session.
     *
     * @param timeout maximum time to wait for the evaluation, null for no limit; when exceeded
     *                the session is aborted with reason {@code timeout}
     */
    public AnswerOutcome submitAnswer(String sessionId, String questionId, String rawText, Duration timeout) {
        InterviewSession session = requireLive(sessionId);

        Question question;
        Answer pending;
        long ticket;
        GenerationContext followUpContext;
        synchronized (session) {
            if (session.getState() != SessionState.AWAITING_ANSWER) {
                throw new InvalidStateException("Session " + sessionId + " is " + session.getState()
                        + "; answers are accepted only while awaiting an answer");
            }
            question = session.currentQuestion();
            if (!question.getId().equals(questionId)) {
                throw new OutOfOrderSubmissionException("Session " + sessionId + " expects an answer to "
                        + question.getId() + ", not " + questionId);
            }
            followUpContext = followUpContext(session);
            pending = Answer.builder().questionId(questionId).rawText(rawText == null ? "" : rawText).build();
            ticket = session.beginEvaluation(pending);
        }
        log.info("Session {} evaluating answer to {}", sessionId, questionId);

        Evaluation evaluation;
        try {
            evaluation = evaluate(question, pending, session.getProfile(), timeout);
        } catch (TimeoutException e) {
            log.warn("Session {} evaluation of {} exceeded {}", sessionId, questionId, timeout);
            abortIfCurrent(session, ticket, "timeout");
            return discarded(session, questionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortIfCurrent(session, ticket, "interrupted");
            return discarded(session, questionId);
        } catch (RuntimeException e) {
            log.error("Session {} could not evaluate answer to {}", sessionId, questionId, e);
            synchronized (session) {
                if (session.isEvaluationCurrent(ticket)) {
                    session.withdraw(questionId);
                }
            }
            throw e;
        }

        Question followUp = needsFollowUp(session, question, evaluation)
                ? followUp(followUpContext, question, pending, evaluation)
                : null;

        AnswerOutcome outcome;
        SessionView completed = null;
        synchronized (session) {
            if (!session.isEvaluationCurrent(ticket)) {
                log.warn("Session {} is {}; discarding late evaluation of {}",
                        sessionId, session.getState(), questionId);
                return discarded(session, questionId);
            }
            session.completeEvaluation(questionId, evaluation, followUp);
            SessionView view = session.view();
            outcome = AnswerOutcome.builder()
                    .sessionId(sessionId)
                    .questionId(questionId)
                    .accepted(true)
                    .evaluation(evaluation)
                    .followUp(followUp)
                    .nextQuestion(view.currentQuestion().orElse(null))
                    .state(view.getState())
                    .build();
            if (view.getState() == SessionState.COMPLETED) {
                completed = view;
            }
        }

        log.info("Session {} answer to {} scored {}", sessionId, questionId, evaluation.getScore());
        if (followUp != null) {
            log.info("Session {} inserted follow-up {} after {}", sessionId, followUp.getId(), questionId);
        }
        if (completed != null) {
            log.info("Session {} completed after {} questions", sessionId, completed.getQuestions().size());
            release(session, completed);
        }
        return outcome;
    }

    public SessionView abort(String sessionId, String reason) {
        InterviewSession session = requireLive(sessionId);
        SessionView view;
        synchronized (session) {
            if (session.getState().isTerminal()) {
                throw new InvalidStateException("Session " + sessionId + " is already " + session.getState());
            }
            if (session.getState() == SessionState.EVALUATING) {
                log.info("Session {} aborted while an evaluation is in flight", sessionId);
            }
            session.abort(reason == null || reason.isBlank() ? "aborted" : reason);
            view = session.view();
        }
        log.info("Session {} aborted: {}", sessionId, view.getAbortReason());
        release(session, view);
        return view;
    }

    /** Works on live and archived sessions alike. */
    public SessionSummary finalizeSession(String sessionId) {
        SessionView view = getSession(sessionId);
        if (view.getState() != SessionState.COMPLETED) {
            throw new NotCompletedException("Session " + sessionId + " is " + view.getState()
                    + "; only completed sessions can be finalized");
        }
        return summarize(view);
    }

    // ─── Queries ────────────────────────────────────────────────────────

    /** Live sessions first, then archived snapshots. */
    public SessionView getSession(String sessionId) {
        InterviewSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session != null) {
            synchronized (session) {
                return session.view();
            }
        }
        return archived(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
    }

    public List<GapEntry> gaps(String sessionId) {
        List<GapEntry> gaps = getSession(sessionId).getGaps();
        return gaps == null ? List.of() : gaps;
    }

    /** Sessions not yet in a terminal state, plus terminal ones that could not be archived. */
    public int activeSessionCount() {
        return sessions.size();
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private Evaluation evaluate(Question question, Answer answer, CandidateProfile profile, Duration timeout)
            throws TimeoutException, InterruptedException {
        FutureTask<Evaluation> task = new FutureTask<>(() -> answerEvaluator.evaluate(question, answer, profile));
        try {
            evaluationExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new EvaluationFailureException("No evaluator capacity for " + question.getId(), e);
        }
        try {
            Evaluation evaluation = timeout == null
                    ? task.get()
                    : task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (evaluation == null) {
                throw new EvaluationFailureException("Evaluator returned no result for " + question.getId());
            }
            return evaluation;
        } catch (TimeoutException | InterruptedException e) {
            // interrupts the evaluator thread
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterviewCoachException) {
                throw (InterviewCoachException) cause;
            }
            throw new EvaluationFailureException("Evaluation of " + question.getId() + " failed: " + cause.getMessage(), cause);
        }
    }

    /** A failed follow-up keeps the evaluation; the session continues with the planned questions. */
    private Question followUp(GenerationContext context, Question question, Answer answer, Evaluation evaluation) {
        try {
            return questionGenerator.generateFollowUp(context, question, answer, evaluation);
        } catch (RuntimeException e) {
            log.warn("Follow-up generation for {} failed; continuing without one", question.getId(), e);
            return null;
        }
    }

    private GenerationContext followUpContext(InterviewSession session) {
        return GenerationContext.builder()
                .type(session.getType())
                .candidate(session.getProfile())
                .requirement(session.getRequirement())
                .gaps(session.getGaps())
                .priorExchanges(session.answeredSoFar())
                .questionCount(1)
                .seed(settings.getRandomSeed())
                .build();
    }

    private boolean needsFollowUp(InterviewSession session, Question question, Evaluation evaluation) {
        synchronized (session) {
            return session.isAdaptive()
                    && !question.isFollowUp()
                    && evaluation.getScore() < settings.getFollowUpThreshold()
                    && !session.hasFollowUpFor(question.getId());
        }
    }

    private void abortIfCurrent(InterviewSession session, long ticket, String reason) {
        SessionView view;
        synchronized (session) {
            if (!session.isEvaluationCurrent(ticket)) {
                return;
            }
            session.abort(reason);
            view = session.view();
        }
        log.info("Session {} aborted: {}", view.getId(), reason);
        release(session, view);
    }

    private void release(InterviewSession session, SessionView terminal) {
        if (archive.archive(terminal)) {
            sessions.remove(session.getId(), session);
            log.debug("Session {} released, {} sessions active", session.getId(), sessions.size());
        } else {
            log.warn("Session {} could not be archived and stays in memory", session.getId());
        }
    }

    private AnswerOutcome discarded(InterviewSession session, String questionId) {
        synchronized (session) {
            return AnswerOutcome.builder()
                    .sessionId(session.getId())
                    .questionId(questionId)
                    .accepted(false)
                    .state(session.getState())
                    .build();
        }
    }

    private SessionSummary summarize(SessionView view) {
        List<QuestionScore> scores = new ArrayList<>();
        Map<String, List<Double>> scoresByArea = new LinkedHashMap<>();
        Map<String, Question> areaSample = new LinkedHashMap<>();
        Map<AnswerDimension, List<Double>> scoresByDimension = new EnumMap<>(AnswerDimension.class);

        for (Question question : view.getQuestions()) {
            Answer answer = view.getAnswers().get(question.getId());
            double score = answer != null && answer.isEvaluated() ? answer.getEvaluation().getScore() : 0.0;
            scores.add(QuestionScore.builder()
                    .questionId(question.getId())
                    .questionText(question.getText())
                    .targetSkill(question.findTargetSkill().map(s -> s.getCanonicalName()).orElse(null))
                    .followUp(question.isFollowUp())
                    .score(score)
                    .build());

            String area = question.findTargetSkill()
                    .map(s -> s.getCanonicalName())
                    .orElse(question.getType().getLabel());
            scoresByArea.computeIfAbsent(area, a -> new ArrayList<>()).add(score);
            areaSample.putIfAbsent(area, question);
            if (answer != null && answer.isEvaluated()) {
                answer.getEvaluation().getDimensions().forEach((dimension, value) ->
                        scoresByDimension.computeIfAbsent(dimension, d -> new ArrayList<>()).add(value));
            }
        }

        List<WeakArea> weakAreas = new ArrayList<>();
        scoresByArea.forEach((area, areaScores) -> weakAreas.add(WeakArea.builder()
                .area(area)
                .skill(areaSample.get(area).getTargetSkill())
                .lowestScore(areaScores.stream().mapToDouble(Double::doubleValue).min().orElse(0.0))
                .meanScore(areaScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))
                .questionCount(areaScores.size())
                .build()));
        scoresByDimension.forEach((dimension, values) -> {
            double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            if (mean < settings.getWeakDimensionThreshold()) {
                weakAreas.add(WeakArea.builder()
                        .area(dimension.getPracticeArea())
                        .dimension(dimension)
                        .lowestScore(values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0))
                        .meanScore(mean)
                        .questionCount(values.size())
                        .build());
            }
        });
        weakAreas.sort(Comparator.comparingDouble(WeakArea::getLowestScore));

        return SessionSummary.builder()
                .sessionId(view.getId())
                .interviewType(view.getInterviewType())
                .totalQuestions(view.getQuestions().size())
                .followUpCount((int) view.getQuestions().stream().filter(Question::isFollowUp).count())
                .meanScore(scores.stream().mapToDouble(QuestionScore::getScore).average().orElse(0.0))
                .weakAreas(List.copyOf(weakAreas))
                .questionScores(List.copyOf(scores))
                .build();
    }

    private static void requireDistinctIds(List<Question> questions) {
        Set<String> ids = new HashSet<>();
        for (Question question : questions) {
            if (!ids.add(question.getId())) {
                throw new IllegalStateException("Question generator produced duplicate id " + question.getId());
            }
        }
    }

    private InterviewSession requireLive(String sessionId) {
        InterviewSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session != null) {
            return session;
        }
        SessionView archived = archived(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
        throw new InvalidStateException("Session " + sessionId + " is already " + archived.getState());
    }

    private Optional<SessionView> archived(String sessionId) {
        return sessionId == null ? Optional.empty() : archive.find(sessionId);
    }
}
