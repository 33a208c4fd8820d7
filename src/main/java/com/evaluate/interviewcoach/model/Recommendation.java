package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Recommendation {
    String resourceId;
    String title;
    String url;
    RecommendationCategory category;
    Skill relatedSkill;
    double score;
    int rank;
}
