package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.model.SkillCategory;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkillNormalizerTest {

    private final SkillVocabulary vocabulary = new SkillVocabulary(
            Map.of("k8s", "Kubernetes", "golang", "Go", "postgres", "PostgreSQL"),
            Map.of("Communication", SkillCategory.BEHAVIORAL));

    private final SkillNormalizer normalizer = new SkillNormalizer(vocabulary);

    private static Set<String> names(Set<Skill> skills) {
        return skills.stream().map(Skill::getCanonicalName).collect(Collectors.toSet());
    }

    @Test
    void caseAndWhitespaceVariantsCollapseToFirstMention() {
        Set<Skill> skills = normalizer.normalize(List.of("Python", "python", "  PYTHON  "));

        assertEquals(1, skills.size());
        Skill python = skills.iterator().next();
        assertEquals("Python", python.getCanonicalName());
        assertTrue(python.getAliases().containsAll(List.of("Python", "python", "PYTHON")));
    }

    @Test
    void aliasTableResolvesToConfiguredCanonicalName() {
        Set<Skill> skills = normalizer.normalize(List.of("k8s", "golang", "Kubernetes"));

        assertEquals(Set.of("Kubernetes", "Go"), names(skills));
    }

    @Test
    void punctuationVariantsMatch() {
        Set<Skill> skills = normalizer.normalize(List.of("Node.js", "NodeJS", "node js"));

        assertEquals(Set.of("Node.js"), names(skills));
    }

    @Test
    void languagesDifferingOnlyBySymbolsStayDistinct() {
        Set<Skill> skills = normalizer.normalize(List.of("C", "C++", "C#"));

        assertEquals(Set.of("C", "C++", "C#"), names(skills));
    }

    @Test
    void blankMentionsAreSkipped() {
        Set<Skill> skills = normalizer.normalize(Arrays.asList("", "   ", null, "SQL"));

        assertEquals(Set.of("SQL"), names(skills));
    }

    @Test
    void knownSkillsKeepTheirCanonicalSpelling() {
        Set<Skill> known = Set.of(Skill.of("Node.js"));

        Set<Skill> skills = normalizer.normalize(List.of("nodejs"), known);

        assertEquals(Set.of("Node.js"), names(skills));
    }

    @Test
    void normalizationIsIdempotent() {
        Set<Skill> first = normalizer.normalize(List.of("k8s", "Python", "python", "Node.js", "C++"));
        Set<Skill> second = normalizer.normalizeSkills(first);

        assertEquals(names(first), names(second));
        assertEquals(first, second);
    }

    @Test
    void configuredCategoryIsApplied() {
        Set<Skill> skills = normalizer.normalize(List.of("communication"));

        Skill skill = skills.iterator().next();
        assertEquals("Communication", skill.getCanonicalName());
        assertEquals(SkillCategory.BEHAVIORAL, skill.getCategory());
    }

    @Test
    void unknownSkillsDefaultToTechnical() {
        Skill skill = normalizer.normalize(List.of("Terraform")).iterator().next();

        assertEquals(SkillCategory.TECHNICAL, skill.getCategory());
    }
}
