package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FinalReport {
    SessionSummary summary;
    List<GapEntry> gaps;
    List<Recommendation> recommendations;
}
