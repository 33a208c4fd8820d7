package com.evaluate.interviewcoach.config;

import com.evaluate.interviewcoach.model.SkillCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds interview.* from application.yml. Every scoring constant of the coach is policy and
 * lives here rather than in code.
 */
@Data
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {

    private Gap gap = new Gap();
    private Session session = new Session();
    private Recommendations recommendations = new Recommendations();
    private Skills skills = new Skills();
    private Llm llm = new Llm();

    @Data
    public static class Gap {
        private double mustHaveWeight = 2.0;
        private double niceToHaveWeight = 1.0;
        /** Multiplier for every gap, scaled per skill category by the job's interview focus. */
        private double relevanceFactor = 1.0;
        /** Largest share of the relevance factor a weakly emphasized category can lose. */
        private double focusSpread = 0.25;
    }

    @Data
    public static class Session {
        private boolean adaptive = true;
        /** Answers scoring strictly below this get one follow-up question. */
        private double followUpThreshold = 0.5;
        /** Number of top gap entries that seed technical and competency sessions. */
        private int seedGaps = 5;
        private int questionsPerSession = 5;
        private long randomSeed = 42L;
        /** Unset means no timeout. */
        private Duration evaluationTimeout;
        /** Answer dimensions whose mean falls below this are reported as weak areas. */
        private double weakDimensionThreshold = 0.7;
    }

    @Data
    public static class Recommendations {
        private double gapWeight = 0.6;
        private double sessionWeight = 0.4;
        private int resourcesPerItem = 2;
        private String catalog = "data/resources.json";
    }

    @Data
    public static class Skills {
        /** alias -> canonical name */
        private Map<String, String> aliases = new LinkedHashMap<>();
        /** canonical name -> category */
        private Map<String, SkillCategory> categories = new LinkedHashMap<>();
    }

    @Data
    public static class Llm {
        private boolean enabled = false;
    }
}
