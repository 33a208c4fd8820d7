package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.config.InterviewProperties;
import com.evaluate.interviewcoach.model.LearningResource;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learning resources keyed by canonical skill, by interview type label and by answer practice
 * area, loaded once from the classpath catalog. Lookups are case-insensitive.
 */
@Service
@Slf4j
public class ResourceCatalog {

    private final ObjectMapper objectMapper;
    private final String location;

    private final Map<String, List<LearningResource>> bySkill = new HashMap<>();
    private final Map<String, List<LearningResource>> byInterviewType = new HashMap<>();
    private final Map<String, List<LearningResource>> byPracticeArea = new HashMap<>();
    private final List<LearningResource> general = new ArrayList<>();

    public ResourceCatalog(ObjectMapper objectMapper, InterviewProperties properties) {
        this.objectMapper = objectMapper;
        this.location = properties.getRecommendations().getCatalog();
    }

    @Data
    static class CatalogFile {
        @JsonProperty("skills")
        private Map<String, List<LearningResource>> skills = new LinkedHashMap<>();
        @JsonProperty("interview_types")
        private Map<String, List<LearningResource>> interviewTypes = new LinkedHashMap<>();
        @JsonProperty("practice_areas")
        private Map<String, List<LearningResource>> practiceAreas = new LinkedHashMap<>();
        @JsonProperty("general")
        private List<LearningResource> general = new ArrayList<>();
    }

    @PostConstruct
    public void initialize() {
        Resource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("Resource catalog {} not found; recommendations will use generated study guides", location);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogFile file = objectMapper.readValue(in, CatalogFile.class);
            file.getSkills().forEach((skill, resources) -> bySkill.put(SkillVocabulary.key(skill), List.copyOf(resources)));
            file.getInterviewTypes().forEach((type, resources) -> byInterviewType.put(SkillVocabulary.key(type), List.copyOf(resources)));
            file.getPracticeAreas().forEach((area, resources) -> byPracticeArea.put(SkillVocabulary.key(area), List.copyOf(resources)));
            general.addAll(file.getGeneral());
            log.info("Loaded resource catalog: {} skills, {} interview types, {} practice areas, {} general resources",
                    bySkill.size(), byInterviewType.size(), byPracticeArea.size(), general.size());
        } catch (IOException e) {
            throw new IllegalStateException("Could not read resource catalog " + location, e);
        }
    }

    public List<LearningResource> forSkill(String canonicalName) {
        return bySkill.getOrDefault(SkillVocabulary.key(canonicalName), List.of());
    }

    public List<LearningResource> forInterviewType(String label) {
        return byInterviewType.getOrDefault(SkillVocabulary.key(label), List.of());
    }

    public List<LearningResource> forPracticeArea(String area) {
        return byPracticeArea.getOrDefault(SkillVocabulary.key(area), List.of());
    }

    public List<LearningResource> general() {
        return List.copyOf(general);
    }
}
