package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Required skills in declaration order. A skill declared twice keeps its first position and
 * the stronger importance.
 */
@Getter
@ToString
@EqualsAndHashCode
public class JobRequirement {

    private final List<RequiredSkill> requiredSkills;
    private final List<String> responsibilities;

    @Builder
    public JobRequirement(List<RequiredSkill> requiredSkills, List<String> responsibilities) {
        this.requiredSkills = distinct(requiredSkills);
        this.responsibilities = responsibilities == null ? List.of() : List.copyOf(responsibilities);
    }

    public boolean isEmpty() {
        return requiredSkills.isEmpty() && responsibilities.isEmpty();
    }

    private static List<RequiredSkill> distinct(List<RequiredSkill> declared) {
        if (declared == null || declared.isEmpty()) {
            return List.of();
        }
        Map<Skill, RequiredSkill> bySkill = new LinkedHashMap<>();
        for (RequiredSkill required : declared) {
            bySkill.merge(required.getSkill(), required, (existing, incoming) ->
                    incoming.getImportance() == Importance.MUST_HAVE
                            ? RequiredSkill.of(existing.getSkill(), Importance.MUST_HAVE)
                            : existing);
        }
        return List.copyOf(new ArrayList<>(bySkill.values()));
    }
}
