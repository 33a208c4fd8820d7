package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.AnswerOutcome;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.FinalReport;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.Recommendation;
import com.evaluate.interviewcoach.model.SessionSummary;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.service.extraction.DocumentFormat;
import com.evaluate.interviewcoach.service.extraction.DocumentIngestionService;
import com.evaluate.interviewcoach.service.extraction.TranscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the REST layer: turns documents into profiles and requirements, then
 * delegates to the session engine and the recommendation engine.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewCoachService {

    private final DocumentIngestionService ingestionService;
    private final GapAnalyzer gapAnalyzer;
    private final SessionEngine sessionEngine;
    private final RecommendationEngine recommendationEngine;
    private final TranscriptionService transcriptionService;

    public List<GapEntry> analyzeGaps(String resumeText, String jobDescriptionText) {
        CandidateProfile profile = ingestionService.buildProfile(nullToEmpty(resumeText));
        JobRequirement requirement = ingestionService.buildRequirement(nullToEmpty(jobDescriptionText), profile.getSkills());
        return gapAnalyzer.analyze(profile, requirement);
    }

    public SessionView startSession(InterviewType type, String resumeText, String jobDescriptionText, Boolean adaptive) {
        CandidateProfile profile = ingestionService.buildProfile(nullToEmpty(resumeText));
        JobRequirement requirement = ingestionService.buildRequirement(nullToEmpty(jobDescriptionText), profile.getSkills());
        return start(type, profile, requirement, adaptive);
    }

    /**
     * @param jobDescription may be null, which starts the session against an empty requirement
     */
    public SessionView startSession(InterviewType type,
                                    byte[] resume, DocumentFormat resumeFormat,
                                    byte[] jobDescription, DocumentFormat jobDescriptionFormat,
                                    Boolean adaptive) {
        CandidateProfile profile = ingestionService.buildProfile(resume, resumeFormat);
        JobRequirement requirement = jobDescription == null || jobDescription.length == 0
                ? ingestionService.buildRequirement("", profile.getSkills())
                : ingestionService.buildRequirement(jobDescription, jobDescriptionFormat, profile.getSkills());
        return start(type, profile, requirement, adaptive);
    }

    public AnswerOutcome submitAnswer(String sessionId, String questionId, String answerText) {
        return sessionEngine.submitAnswer(sessionId, questionId, answerText);
    }

    public AnswerOutcome submitAudioAnswer(String sessionId, String questionId, byte[] audio) {
        String transcript = transcriptionService.transcribe(audio);
        if (transcript.isEmpty()) {
            log.warn("Session {} answer to {} produced no transcript; scoring it as empty", sessionId, questionId);
        }
        return sessionEngine.submitAnswer(sessionId, questionId, transcript);
    }

    public SessionView abort(String sessionId, String reason) {
        return sessionEngine.abort(sessionId, reason);
    }

    public SessionView getSession(String sessionId) {
        return sessionEngine.getSession(sessionId);
    }

    public FinalReport finalizeSession(String sessionId) {
        SessionSummary summary = sessionEngine.finalizeSession(sessionId);
        List<GapEntry> gaps = sessionEngine.gaps(sessionId);
        List<Recommendation> recommendations = recommendationEngine.recommend(gaps, summary);
        log.info("Session {} finalized: mean score {}, {} weak areas, {} recommendations",
                sessionId, summary.getMeanScore(), summary.getWeakAreas().size(), recommendations.size());
        return FinalReport.builder()
                .summary(summary)
                .gaps(gaps)
                .recommendations(recommendations)
                .build();
    }

    private SessionView start(InterviewType type, CandidateProfile profile, JobRequirement requirement, Boolean adaptive) {
        return adaptive == null
                ? sessionEngine.start(type, profile, requirement)
                : sessionEngine.start(type, profile, requirement, adaptive);
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
