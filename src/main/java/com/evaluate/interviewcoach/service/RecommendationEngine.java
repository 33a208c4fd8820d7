package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.Importance;
import com.evaluate.interviewcoach.model.LearningResource;
import com.evaluate.interviewcoach.model.Recommendation;
import com.evaluate.interviewcoach.model.RecommendationCategory;
import com.evaluate.interviewcoach.model.SessionSummary;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.model.WeakArea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns gap entries and session weak areas into a ranked resource list.
 *
 * <p>A gap contributes {@code gapWeight * priority / maxPriority}; a weak area contributes
 * {@code sessionWeight * (1 - lowestScore)}. A resource reached from several items keeps one
 * entry whose score is the sum and whose category is the most urgent one.
 */
@Service
@Slf4j
public class RecommendationEngine {

    private final ResourceCatalog catalog;
    private final InterviewProperties.Recommendations settings;

    public RecommendationEngine(ResourceCatalog catalog, InterviewProperties properties) {
        this.catalog = catalog;
        this.settings = properties.getRecommendations();
    }

    /**
     * @param summary may be null when no session has been run
     */
    public List<Recommendation> recommend(List<GapEntry> gaps, SessionSummary summary) {
        Map<String, Recommendation> byResource = new LinkedHashMap<>();

        double maxPriority = gaps.stream().mapToDouble(GapEntry::getPriorityScore).max().orElse(0.0);
        for (GapEntry gap : gaps) {
            if (gap.getPriorityScore() <= 0) {
                continue;
            }
            RecommendationCategory category = gap.getImportance() == Importance.MUST_HAVE
                    ? RecommendationCategory.PRIORITY
                    : RecommendationCategory.SKILL_DEVELOPMENT;
            double score = settings.getGapWeight() * gap.getPriorityScore() / maxPriority;
            for (LearningResource resource : resourcesFor(gap.getSkill())) {
                merge(byResource, resource, category, gap.getSkill(), score);
            }
        }

        if (summary != null) {
            for (WeakArea area : summary.getWeakAreas()) {
                double score = settings.getSessionWeight() * (1.0 - area.getLowestScore());
                if (score <= 0) {
                    continue;
                }
                List<LearningResource> resources;
                if (area.getSkill() != null) {
                    resources = resourcesFor(area.getSkill());
                } else if (area.getDimension() != null) {
                    resources = limit(catalog.forPracticeArea(area.getArea()));
                } else {
                    resources = limit(catalog.forInterviewType(area.getArea()));
                }
                for (LearningResource resource : resources) {
                    merge(byResource, resource, RecommendationCategory.INTERVIEW_PREP, area.getSkill(), score);
                }
            }
        }

        for (LearningResource resource : catalog.general()) {
            byResource.putIfAbsent(resource.getId(), Recommendation.builder()
                    .resourceId(resource.getId())
                    .title(resource.getTitle())
                    .url(resource.getUrl())
                    .category(RecommendationCategory.ADDITIONAL)
                    .score(0.0)
                    .build());
        }

        List<Recommendation> ordered = new ArrayList<>(byResource.values());
        ordered.sort(Comparator.comparingDouble(Recommendation::getScore).reversed()
                .thenComparing(Recommendation::getCategory));
        List<Recommendation> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ranked.add(ordered.get(i).toBuilder().rank(i + 1).build());
        }
        log.debug("Produced {} recommendations from {} gaps", ranked.size(), gaps.size());
        return List.copyOf(ranked);
    }

    private List<LearningResource> resourcesFor(Skill skill) {
        List<LearningResource> resources = limit(catalog.forSkill(skill.getCanonicalName()));
        if (!resources.isEmpty()) {
            return resources;
        }
        return List.of(LearningResource.builder()
                .id("guide:" + slug(skill.getCanonicalName()))
                .title(skill.getCanonicalName() + " study guide")
                .build());
    }

    private List<LearningResource> limit(List<LearningResource> resources) {
        int max = Math.max(1, settings.getResourcesPerItem());
        return resources.size() <= max ? resources : resources.subList(0, max);
    }

    private static void merge(Map<String, Recommendation> byResource, LearningResource resource,
                              RecommendationCategory category, Skill skill, double score) {
        byResource.merge(resource.getId(),
                Recommendation.builder()
                        .resourceId(resource.getId())
                        .title(resource.getTitle())
                        .url(resource.getUrl())
                        .category(category)
                        .relatedSkill(skill)
                        .score(score)
                        .build(),
                (existing, incoming) -> existing.toBuilder()
                        .score(existing.getScore() + incoming.getScore())
                        .category(existing.getCategory().compareTo(incoming.getCategory()) <= 0
                                ? existing.getCategory() : incoming.getCategory())
                        .relatedSkill(existing.getRelatedSkill() != null ? existing.getRelatedSkill() : incoming.getRelatedSkill())
                        .build());
    }

    static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT)
                .replace("+", "plus")
                .replace("#", "sharp")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "general" : slug;
    }
}
