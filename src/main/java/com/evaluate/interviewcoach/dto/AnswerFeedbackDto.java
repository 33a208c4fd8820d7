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
public class AnswerFeedbackDto {
    private String sessionId;
    private String questionId;
    private Boolean accepted;
    private Double score;
    private List<String> strengths;
    private List<String> weaknesses;
    private QuestionResponseDto followUp;
    private QuestionResponseDto nextQuestion;
    private String state;
}
