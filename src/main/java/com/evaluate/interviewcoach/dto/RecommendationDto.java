package com.evaluate.interviewcoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecommendationDto {
    private Integer rank;
    private String resourceId;
    private String title;
    private String url;
    private String category;
    private String relatedSkill;
    private Double score;
}
