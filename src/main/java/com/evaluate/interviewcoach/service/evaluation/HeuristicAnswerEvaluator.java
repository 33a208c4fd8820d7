package com.evaluate.interviewcoach.service.evaluation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.AnswerDimension;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.Skill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword and length based scoring: relevance to the question (target skill mentioned,
 * question key terms covered) weighted 60%, completeness 40%. Both are reported as
 * dimension scores alongside the overall score.
 */
@Component
@Slf4j
public class HeuristicAnswerEvaluator implements AnswerEvaluator {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9+#]+");
    private static final Pattern WORD = Pattern.compile(".*[A-Za-z]{2,}.*");

    private static final double RELEVANCE_WEIGHT = 0.6;
    private static final double COMPLETENESS_WEIGHT = 0.4;
    private static final double CLAIMED_SKILL_BONUS = 0.1;
    private static final int COMPLETE_ANSWER_WORDS = 80;
    private static final int BRIEF_ANSWER_WORDS = 20;

    private static final Set<String> STOPWORDS = Set.of(
            "about", "after", "also", "because", "been", "before", "being", "could", "describe",
            "does", "each", "explain", "from", "give", "have", "into", "just", "like", "list",
            "more", "most", "much", "only", "other", "over", "resume", "same", "should", "some",
            "step", "tell", "than", "that", "their", "them", "then", "there", "these", "they",
            "this", "through", "time", "under", "very", "walk", "were", "what", "when", "where",
            "which", "while", "with", "would", "your", "you're", "yourself", "how", "why", "who"
    );

    private static final List<String> EXAMPLE_MARKERS = List.of(
            "for example", "for instance", "e.g.", "such as", "when i", "in my last", "at my previous",
            "we built", "i built", "i implemented", "i designed", "i led"
    );

    @Override
    public Evaluation evaluate(Question question, Answer answer, CandidateProfile profile) {
        String text = answer.getRawText() == null ? "" : answer.getRawText().trim();
        if (text.isEmpty()) {
            return Evaluation.builder()
                    .score(0.0)
                    .weaknesses(List.of(NO_RESPONSE))
                    .dimensions(Map.of(AnswerDimension.RELEVANCE, 0.0, AnswerDimension.COMPLETENESS, 0.0))
                    .build();
        }

        String[] words = text.split("\\s+");
        long wordLike = Arrays.stream(words).filter(w -> WORD.matcher(w).matches()).count();
        if ((double) wordLike / words.length < 0.3) {
            return Evaluation.builder()
                    .score(0.0)
                    .weaknesses(List.of("Response is not coherent text", "Provide a structured answer in full sentences"))
                    .dimensions(Map.of(AnswerDimension.RELEVANCE, 0.0, AnswerDimension.COMPLETENESS, 0.0,
                            AnswerDimension.CLARITY, 0.0))
                    .build();
        }

        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> answerTokens = tokens(lower);
        Skill target = question.getTargetSkill();
        boolean skillMentioned = target != null && mentions(lower, target);
        boolean claimed = target != null && profile != null && profile.hasSkill(target);

        Set<String> keyTerms = keyTerms(question, target);
        long covered = keyTerms.stream().filter(answerTokens::contains).count();
        double coverage = keyTerms.isEmpty() ? 0.0 : (double) covered / keyTerms.size();

        double relevance = target != null
                ? 0.5 * (skillMentioned ? 1.0 : 0.0) + 0.5 * coverage
                : coverage;
        double completeness = Math.min(1.0, (double) words.length / COMPLETE_ANSWER_WORDS);
        double score = RELEVANCE_WEIGHT * relevance + COMPLETENESS_WEIGHT * completeness;
        if (claimed && skillMentioned) {
            score += CLAIMED_SKILL_BONUS;
        }
        score = round(Math.min(1.0, score));

        boolean hasExample = EXAMPLE_MARKERS.stream().anyMatch(lower::contains);

        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        if (skillMentioned) {
            strengths.add("Addresses " + target.getCanonicalName() + " directly");
        } else if (target != null) {
            weaknesses.add("Does not mention " + target.getCanonicalName());
        }
        if (coverage >= 0.5) {
            strengths.add("Covers the key points of the question");
        } else if (coverage < 0.3) {
            weaknesses.add("Misses key points of the question");
        }
        if (completeness >= 0.75) {
            strengths.add("Detailed, well-developed answer");
        } else if (words.length < BRIEF_ANSWER_WORDS) {
            weaknesses.add("Answer is brief; add detail and examples");
        }
        if (hasExample) {
            strengths.add("Backs the answer with a concrete example");
        } else {
            weaknesses.add("No concrete example given");
        }
        if (claimed && skillMentioned) {
            strengths.add("Draws on " + target.getCanonicalName() + " experience listed on the resume");
        }

        log.debug("Heuristic evaluation of {}: relevance={}, completeness={}, score={}",
                question.getId(), relevance, completeness, score);
        return new Evaluation(score, strengths, weaknesses, Map.of(
                AnswerDimension.RELEVANCE, round(relevance),
                AnswerDimension.COMPLETENESS, round(completeness)));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static Set<String> keyTerms(Question question, Skill target) {
        Set<String> skillTokens = target == null ? Set.of() : tokens(target.getCanonicalName().toLowerCase(Locale.ROOT));
        return tokens(question.getText().toLowerCase(Locale.ROOT)).stream()
                .filter(t -> t.length() >= 4)
                .filter(t -> !STOPWORDS.contains(t))
                .filter(t -> !skillTokens.contains(t))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Set<String> tokens(String lower) {
        return Arrays.stream(TOKEN_SPLIT.split(lower))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean mentions(String lowerText, Skill skill) {
        if (containsTerm(lowerText, skill.getCanonicalName())) {
            return true;
        }
        return skill.getAliases().stream().anyMatch(alias -> containsTerm(lowerText, alias));
    }

    private static boolean containsTerm(String lowerText, String term) {
        String needle = term.toLowerCase(Locale.ROOT).trim();
        if (needle.isEmpty()) {
            return false;
        }
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(needle) + "(?![a-z0-9+#])")
                .matcher(lowerText)
                .find();
    }
}
