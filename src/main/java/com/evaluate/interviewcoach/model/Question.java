package com.evaluate.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Optional;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Question {
    String id;
    String text;
    InterviewType type;
    /** Lookup only, the skill is owned by the profile or requirement it came from. */
    Skill targetSkill;
    /** Id of the question this one follows up on, null for original questions. */
    String followUpOf;

    @JsonIgnore
    public boolean isFollowUp() {
        return followUpOf != null;
    }

    @JsonIgnore
    public Optional<Skill> findTargetSkill() {
        return Optional.ofNullable(targetSkill);
    }
}
