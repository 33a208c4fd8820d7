package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.Question;

import java.util.List;

/**
 * Produces interview questions. Implementations may be slow (model inference); any randomness
 * must come from {@link GenerationContext#getSeed()}.
 */
public interface QuestionGenerator {

    /**
     * Initial question sequence for a session, at least one question for non-degenerate input.
     *
     * @throws com.evaluate.interviewcoach.exception.InsufficientContextException when a
     *         gap-driven interview type has neither requirement nor gap data
     */
    List<Question> generate(GenerationContext context);

    /**
     * One targeted question following up on a weak answer. The returned question targets the
     * same skill as {@code preceding} and records it in {@link Question#getFollowUpOf()}.
     *
     * @param context the session's type, profile, requirement and gaps, with the exchanges
     *                answered before {@code preceding} in {@link GenerationContext#getPriorExchanges()}
     */
    Question generateFollowUp(GenerationContext context, Question preceding, Answer precedingAnswer,
                              Evaluation evaluation);
}
