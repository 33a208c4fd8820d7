package com.evaluate.interviewcoach.service.evaluation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.Question;

/**
 * Scores one answer against the intent of its question.
 *
 * <p>Contract for implementations:
 * <ul>
 *   <li>an empty answer is a non-answer, scored 0 with a "no response provided" weakness</li>
 *   <li>scores lie in [0, 1] and never decrease when more on-topic, specific content is added</li>
 *   <li>strengths and weaknesses are never null</li>
 * </ul>
 * Implementations may block for a long time; the session engine runs them off the caller's lock.
 */
public interface AnswerEvaluator {

    String NO_RESPONSE = "No response provided";

    Evaluation evaluate(Question question, Answer answer, CandidateProfile profile);
}
