package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.model.EducationLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw, un-normalized findings of one document.
 */
@Value
@Builder
public class ExtractedEntities {

    /** In first-mention order; a phrase may repeat with different importance. */
    @Builder.Default
    List<RequirementMention> mentions = List.of();

    /** Highest "N years of experience" figure found, 0 when none. */
    double experienceYears;

    @Builder.Default
    EducationLevel educationLevel = EducationLevel.UNKNOWN;

    @Builder.Default
    List<String> responsibilities = List.of();

    @Builder.Default
    List<String> rawSegments = List.of();

    public List<String> skillMentions() {
        return mentions.stream().map(RequirementMention::getText).distinct().collect(Collectors.toList());
    }
}
