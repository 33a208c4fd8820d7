package com.evaluate.interviewcoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinalReportDto {
    private String sessionId;
    private String interviewType;
    private Integer totalQuestions;
    private Integer followUpCount;
    private Double meanScore;
    private List<QuestionScoreDto> questionScores;
    private List<WeakAreaDto> weakAreas;
    private List<GapEntryDto> gaps;
    private List<RecommendationDto> recommendations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class QuestionScoreDto {
        private String questionId;
        private String questionText;
        private String targetSkill;
        private Boolean followUp;
        private Double score;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class WeakAreaDto {
        private String area;
        private String dimension;
        private Double lowestScore;
        private Double meanScore;
        private Integer questionCount;
    }
}
