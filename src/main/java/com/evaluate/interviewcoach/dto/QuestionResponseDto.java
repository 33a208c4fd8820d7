package com.evaluate.interviewcoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuestionResponseDto {
    private String id;
    private String sessionId;
    private String questionText;
    private String questionType;
    private String targetSkill;
    private String followUpOf;
}
