package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.service.SkillNormalizer;
import com.evaluate.interviewcoach.service.SkillVocabulary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds normalized profiles and requirements from uploaded documents or pasted text.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final DocumentTextReader textReader;
    private final EntityExtractor entityExtractor;
    private final SkillNormalizer skillNormalizer;

    public CandidateProfile buildProfile(byte[] content, DocumentFormat format) {
        return buildProfile(textReader.read(content, format));
    }

    public CandidateProfile buildProfile(String text) {
        ExtractedEntities entities = entityExtractor.extract(text);
        CandidateProfile profile = CandidateProfile.builder()
                .skills(skillNormalizer.normalize(entities.skillMentions()))
                .experienceYears(entities.getExperienceYears())
                .educationLevel(entities.getEducationLevel())
                .rawSegments(entities.getRawSegments())
                .build();
        log.info("Built candidate profile: {} skills, {} years, {}",
                profile.getSkills().size(), profile.getExperienceYears(), profile.getEducationLevel());
        return profile;
    }

    public JobRequirement buildRequirement(byte[] content, DocumentFormat format, Collection<Skill> known) {
        return buildRequirement(textReader.read(content, format), known);
    }

    /**
     * @param known skills that mentions should resolve onto, usually the candidate's, so both
     *              sides of a gap analysis use the same canonical names
     */
    public JobRequirement buildRequirement(String text, Collection<Skill> known) {
        ExtractedEntities entities = entityExtractor.extract(text);
        Map<String, Skill> resolved = skillNormalizer.resolveAll(entities.skillMentions(), known);

        List<RequiredSkill> required = new ArrayList<>();
        for (RequirementMention mention : entities.getMentions()) {
            Skill skill = resolved.get(SkillVocabulary.clean(mention.getText()));
            if (skill != null) {
                required.add(RequiredSkill.of(skill, mention.getImportance()));
            }
        }
        JobRequirement requirement = JobRequirement.builder()
                .requiredSkills(required)
                .responsibilities(entities.getResponsibilities())
                .build();
        log.info("Built job requirement: {} required skills, {} responsibilities",
                requirement.getRequiredSkills().size(), requirement.getResponsibilities().size());
        return requirement;
    }
}
