package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationContext {
    InterviewType type;
    CandidateProfile candidate;
    JobRequirement requirement;
    /** Seed gap entries, highest priority first. */
    @Builder.Default
    List<GapEntry> gaps = List.of();
    /** Questions answered so far in the session, in asking order. */
    @Builder.Default
    List<PriorExchange> priorExchanges = List.of();
    int questionCount;
    long seed;

    public boolean hasRequirementOrGaps() {
        return !gaps.isEmpty() || (requirement != null && !requirement.isEmpty());
    }
}
