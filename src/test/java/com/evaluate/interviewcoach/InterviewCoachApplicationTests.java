package com.evaluate.interviewcoach;

import com.evaluate.interviewcoach.model.SessionState;
import com.evaluate.interviewcoach.model.SessionView;
import com.evaluate.interviewcoach.service.JpaSessionArchive;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class InterviewCoachApplicationTests {

    private static final String RESUME = "Skills: Python, Docker\n3 years of experience with Flask.";
    private static final String JOB_DESCRIPTION = """
            Requirements:
            - Proficient in Python and Kubernetes.
            Nice to have:
            - Go
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JpaSessionArchive sessionArchive;

    private JsonNode createSession(String type, boolean adaptive) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "interview_type", type,
                "resume_text", RESUME,
                "job_description_text", JOB_DESCRIPTION,
                "adaptive", adaptive));
        String response = mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    private void answer(String sessionId, String questionId, String text) throws Exception {
        mockMvc.perform(post("/api/interview/sessions/{id}/answers", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("question_id", questionId, "answer_text", text))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true));
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/health/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_sessions").isNumber())
                .andExpect(jsonPath("$.dependencies.ollama").value("disabled"))
                .andExpect(jsonPath("$.dependencies.azure_speech").value("disabled"));
    }

    @Test
    void rootEndpoint() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void listsInterviewTypes() throws Exception {
        mockMvc.perform(get("/api/interview/types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.types").isArray())
                .andExpect(jsonPath("$.types[0]").value("Technical"))
                .andExpect(jsonPath("$.types", hasItem("Competency Based")));
    }

    @Test
    void gapAnalysisRanksMissingMustHavesFirst() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("resume_text", RESUME, "job_description_text", JOB_DESCRIPTION));

        mockMvc.perform(post("/api/interview/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].skill").value("Kubernetes"))
                .andExpect(jsonPath("$[0].importance").value("MUST_HAVE"))
                .andExpect(jsonPath("$[0].candidate_has_skill").value(false))
                .andExpect(jsonPath("$[1].skill").value("Go"))
                .andExpect(jsonPath("$[2].skill").value("Python"))
                .andExpect(jsonPath("$[2].priority_score").value(0.0));
    }

    @Test
    void completeSessionProducesFinalReportAndIsArchived() throws Exception {
        JsonNode session = createSession("technical", false);
        String sessionId = session.get("id").asText();
        assertEquals("AWAITING_ANSWER", session.get("state").asText());
        assertEquals("Technical", session.get("interview_type").asText());

        for (JsonNode question : session.get("questions")) {
            answer(sessionId, question.get("id").asText(),
                    "In my last project I designed the deployment pipeline, measured latency and reduced it by 40 percent.");
        }

        mockMvc.perform(get("/api/interview/sessions/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.answered_count").value(session.get("questions").size()));
        mockMvc.perform(get("/api/interview/sessions/{id}/question", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"));

        mockMvc.perform(post("/api/interview/sessions/{id}/finalize", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(sessionId))
                .andExpect(jsonPath("$.total_questions").value(session.get("questions").size()))
                .andExpect(jsonPath("$.question_scores.length()").value(session.get("questions").size()))
                .andExpect(jsonPath("$.gaps[0].skill").value("Kubernetes"))
                .andExpect(jsonPath("$.weak_areas[*].dimension", hasItem("completeness")))
                .andExpect(jsonPath("$.recommendations.length()").value(greaterThan(0)))
                .andExpect(jsonPath("$.recommendations[0].rank").value(1));

        SessionView archived = sessionArchive.find(sessionId).orElseThrow();
        assertEquals(SessionState.COMPLETED, archived.getState());
        assertEquals(session.get("questions").size(), archived.getAnswers().size());
        assertTrue(archived.getAnswers().values().stream().allMatch(a -> a.isEvaluated()));
    }

    @Test
    void abortedSessionIsServedFromTheArchiveAndRejectsAnswers() throws Exception {
        JsonNode session = createSession("behavioral", true);
        String sessionId = session.get("id").asText();
        String firstQuestion = session.get("current_question").get("id").asText();

        mockMvc.perform(post("/api/interview/sessions/{id}/abort", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"candidate left\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ABORTED"))
                .andExpect(jsonPath("$.abort_reason").value("candidate left"));

        mockMvc.perform(post("/api/interview/sessions/{id}/answers", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("question_id", firstQuestion, "answer_text", "late"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));
        mockMvc.perform(get("/api/interview/sessions/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("ABORTED"))
                .andExpect(jsonPath("$.abort_reason").value("candidate left"));

        assertEquals(SessionState.ABORTED, sessionArchive.find(sessionId).orElseThrow().getState());
    }

    @Test
    void audioAnswerWithoutSpeechRecognitionIsScoredAsEmpty() throws Exception {
        JsonNode session = createSession("technical", false);
        String sessionId = session.get("id").asText();
        String firstQuestion = session.get("current_question").get("id").asText();
        MockMultipartFile audio = new MockMultipartFile("audio_file", "answer.wav", "audio/wav", new byte[]{0, 1, 0, 1});

        mockMvc.perform(multipart("/api/interview/sessions/{id}/answers/audio", sessionId)
                        .file(audio)
                        .param("question_id", firstQuestion))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.score").value(0.0));
    }

    @Test
    void outOfOrderAnswerIsRejected() throws Exception {
        JsonNode session = createSession("technical", false);
        String sessionId = session.get("id").asText();
        String secondQuestion = session.get("questions").get(1).get("id").asText();

        mockMvc.perform(post("/api/interview/sessions/{id}/answers", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("question_id", secondQuestion, "answer_text", "skipping ahead"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("OUT_OF_ORDER_SUBMISSION"));
    }

    @Test
    void finalizingAnUnfinishedSessionIsRejected() throws Exception {
        String sessionId = createSession("general", false).get("id").asText();

        mockMvc.perform(post("/api/interview/sessions/{id}/finalize", sessionId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_COMPLETED"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/interview/sessions/{id}", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/interview/sessions/does-not-exist"));
    }

    @Test
    void unsupportedInterviewTypeIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"interview_type\": \"puzzle\", \"resume_text\": \"Skills: Python\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CONFIGURATION"));
    }

    @Test
    void missingInterviewTypeFailsValidation() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resume_text\": \"Skills: Python\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void sessionCanBeStartedFromUploadedTextFiles() throws Exception {
        MockMultipartFile resume = new MockMultipartFile("resume_file", "resume.txt", "text/plain",
                RESUME.getBytes(StandardCharsets.UTF_8));
        MockMultipartFile jobDescription = new MockMultipartFile("job_description_file", "job.txt", "text/plain",
                JOB_DESCRIPTION.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/interview/sessions/upload")
                        .file(resume)
                        .file(jobDescription)
                        .param("interview_type", "competency"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.interview_type").value("Competency Based"))
                .andExpect(jsonPath("$.total_questions").value(greaterThan(0)));
    }

    @Test
    void uploadWithUnknownExtensionIsRejected() throws Exception {
        MockMultipartFile resume = new MockMultipartFile("resume_file", "resume.odt", "application/octet-stream",
                new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/interview/sessions/upload")
                        .file(resume)
                        .param("interview_type", "technical"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_FORMAT"));
    }
}
