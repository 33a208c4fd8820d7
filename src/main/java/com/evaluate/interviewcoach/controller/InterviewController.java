package com.evaluate.interviewcoach.controller;

import com.evaluate.interviewcoach.dto.AbortRequestDto;
import com.evaluate.interviewcoach.dto.AnswerFeedbackDto;
import com.evaluate.interviewcoach.dto.AnswerSubmissionDto;
import com.evaluate.interviewcoach.dto.FinalReportDto;
import com.evaluate.interviewcoach.dto.GapAnalysisRequestDto;
import com.evaluate.interviewcoach.dto.GapEntryDto;
import com.evaluate.interviewcoach.dto.InterviewTypesDto;
import com.evaluate.interviewcoach.dto.QuestionResponseDto;
import com.evaluate.interviewcoach.dto.RecommendationDto;
import com.evaluate.interviewcoach.dto.SessionCreateDto;
import com.evaluate.interviewcoach.dto.SessionResponseDto;
import com.evaluate.interviewcoach.exception.ExtractionFailureException;
import com.evaluate.interviewcoach.model.AnswerOutcome;
import com.evaluate.interviewcoach.model.FinalReport;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.Recommendation;
import com.evaluate.interviewcoach.model.SessionSummary;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.service.InterviewCoachService;
import com.evaluate.interviewcoach.service.extraction.DocumentFormat;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/interview")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final InterviewCoachService coachService;

    // ─── Types ──────────────────────────────────────────────────────────

    @GetMapping("/types")
    public InterviewTypesDto getTypes() {
        return new InterviewTypesDto();
    }

    // ─── Gap analysis ───────────────────────────────────────────────────

    @PostMapping("/analysis")
    public List<GapEntryDto> analyzeGaps(@Valid @RequestBody GapAnalysisRequestDto request) {
        return coachService.analyzeGaps(request.getResumeText(), request.getJobDescriptionText()).stream()
                .map(this::toGapDto)
                .collect(Collectors.toList());
    }

    // ─── Sessions ───────────────────────────────────────────────────────

    @PostMapping("/sessions")
    public ResponseEntity<SessionResponseDto> createSession(@Valid @RequestBody SessionCreateDto dto) {
        SessionView session = coachService.startSession(InterviewType.fromValue(dto.getInterviewType()),
                dto.getResumeText(), dto.getJobDescriptionText(), dto.getAdaptive());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponseDto(session));
    }

    @PostMapping("/sessions/upload")
    public ResponseEntity<SessionResponseDto> createSessionFromFiles(
            @RequestParam("interview_type") String interviewType,
            @RequestParam("resume_file") MultipartFile resumeFile,
            @RequestParam(value = "job_description_file", required = false) MultipartFile jobDescriptionFile,
            @RequestParam(value = "resume_format", required = false) String resumeFormat,
            @RequestParam(value = "job_description_format", required = false) String jobDescriptionFormat,
            @RequestParam(value = "adaptive", required = false) Boolean adaptive) {
        InterviewType type = InterviewType.fromValue(interviewType);
        byte[] resume = bytes(resumeFile);
        DocumentFormat resumeDocFormat = format(resumeFormat, resumeFile);

        SessionView session;
        if (jobDescriptionFile == null || jobDescriptionFile.isEmpty()) {
            log.info("Creating {} session from résumé {} without a job description", type, resumeFile.getOriginalFilename());
            session = coachService.startSession(type, resume, resumeDocFormat, null, null, adaptive);
        } else {
            session = coachService.startSession(type, resume, resumeDocFormat,
                    bytes(jobDescriptionFile), format(jobDescriptionFormat, jobDescriptionFile), adaptive);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponseDto(session));
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionResponseDto getSession(@PathVariable String sessionId) {
        return toResponseDto(coachService.getSession(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/question")
    public ResponseEntity<?> getCurrentQuestion(@PathVariable String sessionId) {
        SessionView session = coachService.getSession(sessionId);
        return session.currentQuestion()
                .<ResponseEntity<?>>map(q -> ResponseEntity.ok(toQuestionDto(sessionId, q)))
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "session_id", sessionId,
                        "state", session.getState().name(),
                        "message", "No question is awaiting an answer")));
    }

    @PostMapping("/sessions/{sessionId}/abort")
    public SessionResponseDto abortSession(@PathVariable String sessionId,
                                           @RequestBody(required = false) AbortRequestDto request) {
        String reason = request != null ? request.getReason() : null;
        return toResponseDto(coachService.abort(sessionId, reason));
    }

    @PostMapping("/sessions/{sessionId}/finalize")
    public FinalReportDto finalizeSession(@PathVariable String sessionId) {
        return toReportDto(coachService.finalizeSession(sessionId));
    }

    // ─── Answers ────────────────────────────────────────────────────────

    @PostMapping("/sessions/{sessionId}/answers")
    public AnswerFeedbackDto submitAnswer(@PathVariable String sessionId,
                                          @Valid @RequestBody AnswerSubmissionDto answer) {
        return toFeedbackDto(coachService.submitAnswer(sessionId, answer.getQuestionId(), answer.getAnswerText()));
    }

    @PostMapping("/sessions/{sessionId}/answers/audio")
    public AnswerFeedbackDto submitAudioAnswer(@PathVariable String sessionId,
                                               @RequestParam("question_id") String questionId,
                                               @RequestParam("audio_file") MultipartFile audioFile) {
        return toFeedbackDto(coachService.submitAudioAnswer(sessionId, questionId, bytes(audioFile)));
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private static byte[] bytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ExtractionFailureException("Could not read uploaded file " + file.getOriginalFilename(), e);
        }
    }

    private static DocumentFormat format(String declared, MultipartFile file) {
        return declared != null && !declared.isBlank()
                ? DocumentFormat.fromValue(declared)
                : DocumentFormat.fromFilename(file.getOriginalFilename());
    }

    private SessionResponseDto toResponseDto(SessionView session) {
        return SessionResponseDto.builder()
                .id(session.getId())
                .interviewType(session.getInterviewType().getLabel())
                .state(session.getState().name())
                .adaptive(session.isAdaptive())
                .totalQuestions(session.getQuestions().size())
                .answeredCount((int) session.getAnswers().values().stream().filter(a -> a.isEvaluated()).count())
                .currentQuestion(session.currentQuestion().map(q -> toQuestionDto(session.getId(), q)).orElse(null))
                .questions(session.getQuestions().stream()
                        .map(q -> toQuestionDto(session.getId(), q))
                        .collect(Collectors.toList()))
                .abortReason(session.getAbortReason())
                .createdAt(session.getCreatedAt())
                .completedAt(session.getCompletedAt())
                .build();
    }

    private QuestionResponseDto toQuestionDto(String sessionId, Question q) {
        if (q == null) {
            return null;
        }
        return QuestionResponseDto.builder()
                .id(q.getId())
                .sessionId(sessionId)
                .questionText(q.getText())
                .questionType(q.getType().getLabel())
                .targetSkill(q.findTargetSkill().map(s -> s.getCanonicalName()).orElse(null))
                .followUpOf(q.getFollowUpOf())
                .build();
    }

    private AnswerFeedbackDto toFeedbackDto(AnswerOutcome outcome) {
        AnswerFeedbackDto.AnswerFeedbackDtoBuilder builder = AnswerFeedbackDto.builder()
                .sessionId(outcome.getSessionId())
                .questionId(outcome.getQuestionId())
                .accepted(outcome.isAccepted())
                .followUp(toQuestionDto(outcome.getSessionId(), outcome.getFollowUp()))
                .nextQuestion(toQuestionDto(outcome.getSessionId(), outcome.getNextQuestion()))
                .state(outcome.getState().name());
        if (outcome.getEvaluation() != null) {
            builder.score(outcome.getEvaluation().getScore())
                    .strengths(outcome.getEvaluation().getStrengths())
                    .weaknesses(outcome.getEvaluation().getWeaknesses());
        }
        return builder.build();
    }

    private GapEntryDto toGapDto(GapEntry gap) {
        return GapEntryDto.builder()
                .skill(gap.getSkill().getCanonicalName())
                .category(gap.getSkill().getCategory().name())
                .importance(gap.getImportance().name())
                .candidateHasSkill(gap.isCandidateHasSkill())
                .priorityScore(gap.getPriorityScore())
                .build();
    }

    private RecommendationDto toRecommendationDto(Recommendation r) {
        return RecommendationDto.builder()
                .rank(r.getRank())
                .resourceId(r.getResourceId())
                .title(r.getTitle())
                .url(r.getUrl())
                .category(r.getCategory().name())
                .relatedSkill(r.getRelatedSkill() != null ? r.getRelatedSkill().getCanonicalName() : null)
                .score(r.getScore())
                .build();
    }

    private FinalReportDto toReportDto(FinalReport report) {
        SessionSummary summary = report.getSummary();
        return FinalReportDto.builder()
                .sessionId(summary.getSessionId())
                .interviewType(summary.getInterviewType().getLabel())
                .totalQuestions(summary.getTotalQuestions())
                .followUpCount(summary.getFollowUpCount())
                .meanScore(summary.getMeanScore())
                .questionScores(summary.getQuestionScores().stream()
                        .map(s -> FinalReportDto.QuestionScoreDto.builder()
                                .questionId(s.getQuestionId())
                                .questionText(s.getQuestionText())
                                .targetSkill(s.getTargetSkill())
                                .followUp(s.isFollowUp())
                                .score(s.getScore())
                                .build())
                        .collect(Collectors.toList()))
                .weakAreas(summary.getWeakAreas().stream()
                        .map(w -> FinalReportDto.WeakAreaDto.builder()
                                .area(w.getArea())
                                .dimension(w.getDimension() == null ? null : w.getDimension().name().toLowerCase())
                                .lowestScore(w.getLowestScore())
                                .meanScore(w.getMeanScore())
                                .questionCount(w.getQuestionCount())
                                .build())
                        .collect(Collectors.toList()))
                .gaps(report.getGaps().stream().map(this::toGapDto).collect(Collectors.toList()))
                .recommendations(report.getRecommendations().stream()
                        .map(this::toRecommendationDto)
                        .collect(Collectors.toList()))
                .build();
    }
}
