package com.evaluate.interviewcoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponseDto {
    private String id;
    private String interviewType;
    private String state;
    private Boolean adaptive;
    private Integer totalQuestions;
    private Integer answeredCount;
    private QuestionResponseDto currentQuestion;
    private List<QuestionResponseDto> questions;
    private String abortReason;
    private Instant createdAt;
    private Instant completedAt;
}
