package com.evaluate.interviewcoach.service.evaluation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.AnswerDimension;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.service.OllamaClient;
import com.evaluate.interviewcoach.service.PromptFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Primary
@ConditionalOnProperty(prefix = "interview.llm", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class LlmAnswerEvaluator implements AnswerEvaluator {

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");
    private static final Map<String, AnswerDimension> DIMENSION_LINES = Map.of(
            "Relevance:", AnswerDimension.RELEVANCE,
            "Completeness:", AnswerDimension.COMPLETENESS,
            "Clarity:", AnswerDimension.CLARITY);

    private final OllamaClient ollamaClient;
    private final PromptFactory promptFactory;
    private final HeuristicAnswerEvaluator fallback;

    @Override
    public Evaluation evaluate(Question question, Answer answer, CandidateProfile profile) {
        if (answer.getRawText() == null || answer.getRawText().isBlank()) {
            return fallback.evaluate(question, answer, profile);
        }

        Optional<Evaluation> parsed = ollamaClient.generate(promptFactory.evaluationPrompt(question, answer, profile))
                .flatMap(this::parse);
        if (parsed.isEmpty()) {
            log.warn("Could not use model evaluation for {}, falling back to heuristics", question.getId());
            return fallback.evaluate(question, answer, profile);
        }
        return parsed.get();
    }

    Optional<Evaluation> parse(String response) {
        Double score = null;
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        Map<AnswerDimension, Double> dimensions = new EnumMap<>(AnswerDimension.class);
        List<String> currentSection = null;

        for (String raw : response.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            Optional<String> dimensionLine = DIMENSION_LINES.keySet().stream().filter(line::startsWith).findFirst();
            if (line.startsWith("Score:")) {
                currentSection = null;
                score = number(line.substring("Score:".length())).orElse(score);
            } else if (dimensionLine.isPresent()) {
                currentSection = null;
                String label = dimensionLine.get();
                number(line.substring(label.length()))
                        .ifPresent(value -> dimensions.put(DIMENSION_LINES.get(label), value));
            } else if (line.startsWith("Strengths:")) {
                currentSection = strengths;
                addInline(strengths, line.substring("Strengths:".length()));
            } else if (line.startsWith("Weaknesses:")) {
                currentSection = weaknesses;
                addInline(weaknesses, line.substring("Weaknesses:".length()));
            } else if (currentSection != null) {
                addInline(currentSection, line.replaceAll("^[-*•\\d.)]+\\s*", ""));
            }
        }

        if (score == null) {
            return Optional.empty();
        }
        return Optional.of(new Evaluation(score, strengths, weaknesses, dimensions));
    }

    private static Optional<Double> number(String text) {
        Matcher matcher = NUMBER.matcher(text);
        return matcher.find() ? Optional.of(toUnitInterval(Double.parseDouble(matcher.group(1)))) : Optional.empty();
    }

    /** Accepts 0-1, 0-10 and 0-100 scales. */
    private static double toUnitInterval(double value) {
        double scaled;
        if (value <= 1.0 && value != Math.floor(value)) {
            scaled = value;
        } else if (value <= 10.0) {
            scaled = value / 10.0;
        } else {
            scaled = value / 100.0;
        }
        return Math.max(0.0, Math.min(1.0, scaled));
    }

    private static void addInline(List<String> section, String content) {
        String clean = content.trim();
        if (!clean.isEmpty() && !clean.startsWith("[")) {
            section.add(clean);
        }
    }
}
