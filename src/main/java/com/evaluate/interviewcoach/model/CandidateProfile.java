package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class CandidateProfile {

    @Builder.Default
    Set<Skill> skills = Set.of();

    double experienceYears;

    @Builder.Default
    EducationLevel educationLevel = EducationLevel.UNKNOWN;

    @Builder.Default
    List<String> rawSegments = List.of();

    public boolean hasSkill(Skill skill) {
        return skills.contains(skill);
    }
}
