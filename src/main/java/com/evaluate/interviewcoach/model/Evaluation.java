package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
public class Evaluation {

    private final double score;
    private final List<String> strengths;
    private final List<String> weaknesses;
    /** Per-dimension scores in [0, 1]; an evaluator reports only the dimensions it measures. */
    private final Map<AnswerDimension, Double> dimensions;

    public Evaluation(double score, List<String> strengths, List<String> weaknesses) {
        this(score, strengths, weaknesses, null);
    }

    @Builder
    @Jacksonized
    public Evaluation(double score, List<String> strengths, List<String> weaknesses,
                      Map<AnswerDimension, Double> dimensions) {
        requireUnitInterval("Evaluation score", score);
        this.score = score;
        this.strengths = strengths == null ? List.of() : List.copyOf(strengths);
        this.weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        if (dimensions == null || dimensions.isEmpty()) {
            this.dimensions = Map.of();
        } else {
            dimensions.forEach((dimension, value) -> requireUnitInterval(dimension + " score", value));
            this.dimensions = Collections.unmodifiableMap(new EnumMap<>(dimensions));
        }
    }

    public Optional<Double> dimension(AnswerDimension dimension) {
        return Optional.ofNullable(dimensions.get(dimension));
    }

    private static void requireUnitInterval(String what, Double value) {
        if (value == null || Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(what + " must be within [0, 1], got " + value);
        }
    }
}
