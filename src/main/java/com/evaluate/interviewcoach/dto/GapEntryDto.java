package com.evaluate.interviewcoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GapEntryDto {
    private String skill;
    private String category;
    private String importance;
    private Boolean candidateHasSkill;
    private Double priorityScore;
}
