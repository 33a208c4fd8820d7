package com.evaluate.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionViewJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static SessionView completedSession() {
        Skill kubernetes = Skill.of("Kubernetes");
        Question first = Question.builder()
                .id("q1").text("How does a Kubernetes Deployment roll out a new version?")
                .type(InterviewType.TECHNICAL).targetSkill(kubernetes).build();
        Question followUp = Question.builder()
                .id("q1-f").text("What happens when the new pods never become ready?")
                .type(InterviewType.TECHNICAL).targetSkill(kubernetes).followUpOf("q1").build();

        Map<String, Answer> answers = new LinkedHashMap<>();
        answers.put("q1", Answer.builder().questionId("q1").rawText("It replaces pods.")
                .evaluation(Evaluation.builder().score(0.3).weaknesses(List.of("Too brief"))
                        .dimensions(Map.of(AnswerDimension.RELEVANCE, 0.5, AnswerDimension.COMPLETENESS, 0.1))
                        .build()).build());
        answers.put("q1-f", Answer.builder().questionId("q1-f").rawText("The rollout stalls and can be undone.")
                .evaluation(Evaluation.builder().score(0.7).strengths(List.of("Mentions rollback")).build()).build());

        return SessionView.builder()
                .id("session-1")
                .interviewType(InterviewType.TECHNICAL)
                .state(SessionState.COMPLETED)
                .questions(List.of(first, followUp))
                .answers(answers)
                .currentIndex(2)
                .adaptive(true)
                .gaps(List.of(GapEntry.builder().skill(kubernetes).importance(Importance.MUST_HAVE)
                        .candidateHasSkill(false).priorityScore(2.0).build()))
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .completedAt(Instant.parse("2024-05-01T10:20:00Z"))
                .build();
    }

    @Test
    void archivedShapeRestoresTheSameSession() throws Exception {
        SessionView session = completedSession();

        SessionView restored = objectMapper.readValue(objectMapper.writeValueAsString(session), SessionView.class);

        assertEquals(session, restored);
        assertEquals(List.of("q1", "q1-f"), List.copyOf(restored.getAnswers().keySet()));
        assertTrue(restored.getQuestions().get(1).isFollowUp());
        assertEquals(0.1, restored.getAnswers().get("q1").getEvaluation()
                .dimension(AnswerDimension.COMPLETENESS).orElseThrow(), 1e-9);
        assertEquals(2.0, restored.getGaps().get(0).getPriorityScore(), 1e-9);
    }

    @Test
    void persistedFieldNamesAreSnakeCase() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(completedSession()));

        assertEquals("COMPLETED", json.get("state").asText());
        assertEquals("TECHNICAL", json.get("interview_type").asText());
        assertEquals("q1", json.get("questions").get(1).get("follow_up_of").asText());
        assertEquals(0.3, json.get("answers").get("q1").get("evaluation").get("score").asDouble());
        assertFalse(json.has("abort_reason"));
        assertEquals(0.1, json.get("answers").get("q1").get("evaluation").get("dimensions").get("COMPLETENESS").asDouble());
        assertFalse(json.get("gaps").get(0).get("candidate_has_skill").asBoolean());
        assertFalse(json.get("answers").get("q1").has("evaluated"));
    }
}
