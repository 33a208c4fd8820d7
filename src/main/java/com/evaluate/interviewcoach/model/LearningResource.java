package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LearningResource {
    String id;
    String title;
    String url;
}
