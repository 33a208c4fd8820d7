package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.model.Importance;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class RequirementMention {
    String text;
    Importance importance;
}
