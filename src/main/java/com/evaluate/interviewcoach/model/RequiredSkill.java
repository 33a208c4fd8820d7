package com.evaluate.interviewcoach.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class RequiredSkill {
    Skill skill;
    Importance importance;
}
