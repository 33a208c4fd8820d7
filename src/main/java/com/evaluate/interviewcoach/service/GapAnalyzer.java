package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.exception.InvalidConfigurationException;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.Importance;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.SkillCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Compares a candidate's skills with a job's required skills.
 *
 * <p>Every required skill yields exactly one entry. A skill counts as held only on an exact
 * canonical match. Entries are ordered by descending priority; equal priorities keep the
 * requirement's declaration order.
 *
 * <p>The relevance factor of an entry follows the job's interview focus: the share of required
 * skills and responsibility lines pointing at each skill category. The most emphasized category
 * keeps the full factor and the others lose up to {@code focusSpread} of it, which is bounded so
 * a missing must-have always outranks a missing nice-to-have.
 */
@Service
@Slf4j
public class GapAnalyzer {

    private static final Map<SkillCategory, List<String>> FOCUS_KEYWORDS = Map.of(
            SkillCategory.TECHNICAL, List.of("programming", "software", "technical", "code", "development"),
            SkillCategory.DOMAIN, List.of("industry", "business", "domain", "field", "sector"),
            SkillCategory.BEHAVIORAL, List.of("communication", "team", "leadership", "collaborative", "interpersonal"));

    private final InterviewProperties properties;

    public GapAnalyzer(InterviewProperties properties) {
        InterviewProperties.Gap gap = properties.getGap();
        if (gap.getMustHaveWeight() <= gap.getNiceToHaveWeight() || gap.getNiceToHaveWeight() <= 0) {
            throw new InvalidConfigurationException("interview.gap weights must satisfy must-have > nice-to-have > 0, got "
                    + gap.getMustHaveWeight() + " / " + gap.getNiceToHaveWeight());
        }
        if (gap.getRelevanceFactor() <= 0) {
            throw new InvalidConfigurationException("interview.gap.relevance-factor must be positive");
        }
        if (gap.getFocusSpread() < 0 || gap.getFocusSpread() >= 1
                || gap.getMustHaveWeight() * (1 - gap.getFocusSpread()) <= gap.getNiceToHaveWeight()) {
            throw new InvalidConfigurationException("interview.gap.focus-spread must be in [0, 1) and keep "
                    + "must-have * (1 - focus-spread) above nice-to-have, got " + gap.getFocusSpread());
        }
        this.properties = properties;
    }

    public List<GapEntry> analyze(CandidateProfile profile, JobRequirement requirement) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(requirement, "requirement");

        Map<SkillCategory, Double> focus = focusFactors(requirement);
        List<GapEntry> entries = new ArrayList<>(requirement.getRequiredSkills().size());
        for (RequiredSkill required : requirement.getRequiredSkills()) {
            boolean held = profile.hasSkill(required.getSkill());
            double relevance = properties.getGap().getRelevanceFactor() * focus.getOrDefault(required.getSkill().getCategory(), 1.0);
            entries.add(GapEntry.builder()
                    .skill(required.getSkill())
                    .importance(required.getImportance())
                    .candidateHasSkill(held)
                    .priorityScore(importanceWeight(required.getImportance()) * (held ? 0.0 : 1.0) * relevance)
                    .build());
        }
        // List.sort is stable, ties stay in declaration order
        entries.sort(Comparator.comparingDouble(GapEntry::getPriorityScore).reversed());

        log.info("Gap analysis: {} required skills, {} missing, focus {}",
                entries.size(), entries.stream().filter(e -> !e.isCandidateHasSkill()).count(), focus);
        return List.copyOf(entries);
    }

    private double importanceWeight(Importance importance) {
        InterviewProperties.Gap gap = properties.getGap();
        return importance == Importance.MUST_HAVE ? gap.getMustHaveWeight() : gap.getNiceToHaveWeight();
    }

    private Map<SkillCategory, Double> focusFactors(JobRequirement requirement) {
        Map<SkillCategory, Integer> signals = new EnumMap<>(SkillCategory.class);
        for (SkillCategory category : SkillCategory.values()) {
            signals.put(category, 0);
        }
        for (RequiredSkill required : requirement.getRequiredSkills()) {
            if (required.getSkill().getCategory() != null) {
                signals.merge(required.getSkill().getCategory(), 1, Integer::sum);
            }
        }
        for (String responsibility : requirement.getResponsibilities()) {
            String lower = responsibility.toLowerCase(Locale.ROOT);
            FOCUS_KEYWORDS.forEach((category, keywords) -> {
                if (keywords.stream().anyMatch(lower::contains)) {
                    signals.merge(category, 1, Integer::sum);
                }
            });
        }

        int strongest = signals.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double spread = properties.getGap().getFocusSpread();
        Map<SkillCategory, Double> factors = new EnumMap<>(SkillCategory.class);
        signals.forEach((category, count) -> factors.put(category,
                strongest == 0 ? 1.0 : 1.0 - spread * (1.0 - (double) count / strongest)));
        return factors;
    }
}
