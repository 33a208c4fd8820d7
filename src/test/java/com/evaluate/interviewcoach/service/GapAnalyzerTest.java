package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.exception.InvalidConfigurationException;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.Importance;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.model.SkillCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GapAnalyzerTest {

    private static final Skill PYTHON = Skill.of("Python");
    private static final Skill SQL = Skill.of("SQL");
    private static final Skill KUBERNETES = Skill.of("Kubernetes");
    private static final Skill GO = Skill.of("Go");
    private static final Skill COMMUNICATION = Skill.of("Communication", SkillCategory.BEHAVIORAL);

    private final GapAnalyzer analyzer = new GapAnalyzer(new InterviewProperties());

    private static CandidateProfile candidate(Skill... skills) {
        return CandidateProfile.builder().skills(Set.of(skills)).build();
    }

    @Test
    void missingMustHaveRanksAboveMissingNiceToHaveAboveHeldSkills() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(PYTHON, Importance.MUST_HAVE),
                        RequiredSkill.of(SQL, Importance.MUST_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(GO, Importance.NICE_TO_HAVE)))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(PYTHON, SQL), requirement);

        assertEquals(List.of("Kubernetes", "Go", "Python", "SQL"),
                gaps.stream().map(g -> g.getSkill().getCanonicalName()).collect(Collectors.toList()));
        assertEquals(2.0, gaps.get(0).getPriorityScore(), 1e-9);
        assertEquals(1.0, gaps.get(1).getPriorityScore(), 1e-9);
        assertEquals(0.0, gaps.get(2).getPriorityScore(), 1e-9);
        assertFalse(gaps.get(0).isCandidateHasSkill());
        assertTrue(gaps.get(2).isCandidateHasSkill());
    }

    @Test
    void everyRequiredSkillYieldsExactlyOneEntry() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(GO, Importance.NICE_TO_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(GO, Importance.MUST_HAVE)))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(), requirement);

        assertEquals(2, gaps.size());
        assertTrue(gaps.stream().allMatch(g -> g.getImportance() == Importance.MUST_HAVE));
    }

    @Test
    void equalPrioritiesKeepDeclarationOrder() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(GO, Importance.MUST_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(SQL, Importance.MUST_HAVE)))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(), requirement);

        assertEquals(List.of(GO, KUBERNETES, SQL), gaps.stream().map(GapEntry::getSkill).collect(Collectors.toList()));
    }

    @Test
    void emptyRequirementYieldsNoEntries() {
        assertTrue(analyzer.analyze(candidate(PYTHON), JobRequirement.builder().build()).isEmpty());
    }

    @Test
    void priorityScoresAreNeverNegative() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(RequiredSkill.of(PYTHON, Importance.NICE_TO_HAVE)))
                .build();

        assertTrue(analyzer.analyze(candidate(PYTHON), requirement).stream().allMatch(g -> g.getPriorityScore() >= 0));
    }

    @Test
    void niceToHaveWeightMustStayBelowMustHave() {
        InterviewProperties properties = new InterviewProperties();
        properties.getGap().setNiceToHaveWeight(2.0);

        assertThrows(InvalidConfigurationException.class, () -> new GapAnalyzer(properties));
    }

    @Test
    void relevanceFactorMustBePositive() {
        InterviewProperties properties = new InterviewProperties();
        properties.getGap().setRelevanceFactor(0.0);

        assertThrows(InvalidConfigurationException.class, () -> new GapAnalyzer(properties));
    }

    @Test
    void lessEmphasizedCategoryLosesPartOfItsPriority() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(COMMUNICATION, Importance.MUST_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(SQL, Importance.MUST_HAVE)))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(), requirement);

        assertEquals(List.of(KUBERNETES, SQL, COMMUNICATION), gaps.stream().map(GapEntry::getSkill).collect(Collectors.toList()));
        assertEquals(2.0, gaps.get(0).getPriorityScore(), 1e-9);
        // behavioral holds half the technical share: 2.0 * (1 - 0.25 * 0.5)
        assertEquals(1.75, gaps.get(2).getPriorityScore(), 1e-9);
    }

    @Test
    void responsibilitiesShiftTheFocus() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(COMMUNICATION, Importance.MUST_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(SQL, Importance.MUST_HAVE)))
                .responsibilities(List.of("Lead a small team of engineers", "Present roadmaps to the leadership group"))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(), requirement);

        assertEquals(List.of(COMMUNICATION, KUBERNETES, SQL), gaps.stream().map(GapEntry::getSkill).collect(Collectors.toList()));
        assertEquals(2.0, gaps.get(0).getPriorityScore(), 1e-9);
        // technical now holds two of three behavioral signals
        assertEquals(2.0 * (1 - 0.25 * (1 - 2.0 / 3)), gaps.get(1).getPriorityScore(), 1e-9);
    }

    @Test
    void missingMustHaveOutranksNiceToHaveInTheEmphasizedCategory() {
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(List.of(
                        RequiredSkill.of(GO, Importance.NICE_TO_HAVE),
                        RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE),
                        RequiredSkill.of(SQL, Importance.MUST_HAVE),
                        RequiredSkill.of(PYTHON, Importance.MUST_HAVE),
                        RequiredSkill.of(COMMUNICATION, Importance.MUST_HAVE)))
                .build();

        List<GapEntry> gaps = analyzer.analyze(candidate(), requirement);

        assertEquals(COMMUNICATION, gaps.get(3).getSkill());
        assertEquals(GO, gaps.get(4).getSkill());
        assertTrue(gaps.get(3).getPriorityScore() > gaps.get(4).getPriorityScore());
    }

    @Test
    void focusSpreadMustKeepImportanceOrdering() {
        InterviewProperties properties = new InterviewProperties();
        properties.getGap().setFocusSpread(0.5);

        assertThrows(InvalidConfigurationException.class, () -> new GapAnalyzer(properties));
    }
}
