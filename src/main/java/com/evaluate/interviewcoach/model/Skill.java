package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * A canonical skill. Identity is the canonical name only; aliases and category are
 * descriptive.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Skill {

    @EqualsAndHashCode.Include
    String canonicalName;

    @Builder.Default
    Set<String> aliases = Set.of();

    @Builder.Default
    SkillCategory category = SkillCategory.TECHNICAL;

    public static Skill of(String canonicalName) {
        return Skill.builder().canonicalName(canonicalName).build();
    }

    public static Skill of(String canonicalName, SkillCategory category) {
        return Skill.builder().canonicalName(canonicalName).category(category).build();
    }
}
