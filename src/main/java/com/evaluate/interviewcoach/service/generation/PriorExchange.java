package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.Question;
import lombok.Value;

/** A question already asked in the session together with its evaluated answer. */
@Value
public class PriorExchange {
    Question question;
    Answer answer;
}
