package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.Importance;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.service.OllamaClient;
import com.evaluate.interviewcoach.service.PromptFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmQuestionGeneratorTest {

    private static final Skill KUBERNETES = Skill.builder().canonicalName("Kubernetes").aliases(Set.of("k8s")).build();

    private OllamaClient ollamaClient;
    private LlmQuestionGenerator generator;

    @BeforeEach
    void setUp() {
        ollamaClient = mock(OllamaClient.class);
        generator = new LlmQuestionGenerator(ollamaClient, new PromptFactory(), new TemplateQuestionGenerator());
    }

    private static GenerationContext context(int count) {
        return GenerationContext.builder()
                .type(InterviewType.TECHNICAL)
                .candidate(CandidateProfile.builder().build())
                .requirement(JobRequirement.builder()
                        .requiredSkills(List.of(RequiredSkill.of(KUBERNETES, Importance.MUST_HAVE)))
                        .build())
                .gaps(List.of(GapEntry.builder().skill(KUBERNETES).importance(Importance.MUST_HAVE).priorityScore(2.0).build()))
                .questionCount(count)
                .seed(7L)
                .build();
    }

    @Test
    void numberedLinesBecomeQuestionsWithMatchedTargets() {
        when(ollamaClient.generate(anyString())).thenReturn(Optional.of("""
                Here are your questions:
                1. Question: How would you size resource requests for a k8s workload?
                2) Describe a time you had to debug a flaky integration test.
                3. Too short
                """));

        List<Question> questions = generator.generate(context(5));

        assertEquals(2, questions.size());
        assertEquals("q1", questions.get(0).getId());
        assertEquals("How would you size resource requests for a k8s workload?", questions.get(0).getText());
        assertEquals(KUBERNETES, questions.get(0).getTargetSkill());
        assertNull(questions.get(1).getTargetSkill());
    }

    @Test
    void questionCountCapsTheModelOutput() {
        when(ollamaClient.generate(anyString())).thenReturn(Optional.of("""
                1. Explain how a Kubernetes Service routes traffic to pods.
                2. How does a Kubernetes Deployment perform a rolling update?
                3. When would you choose a StatefulSet over a Deployment?
                """));

        assertEquals(2, generator.generate(context(2)).size());
    }

    @Test
    void unavailableModelFallsBackToTemplates() {
        when(ollamaClient.generate(anyString())).thenReturn(Optional.empty());

        List<Question> questions = generator.generate(context(3));

        assertEquals(new TemplateQuestionGenerator().generate(context(3)), questions);
    }

    @Test
    void followUpKeepsTargetAndLinksToPreceding() {
        Question preceding = Question.builder()
                .id("q1").text("How would you size resource requests for a k8s workload?")
                .type(InterviewType.TECHNICAL).targetSkill(KUBERNETES).build();
        when(ollamaClient.generate(anyString())).thenReturn(Optional.of("Follow-up: What metrics would tell you the requests are wrong?\n"));

        Question followUp = generator.generateFollowUp(context(1), preceding,
                Answer.builder().questionId("q1").rawText("I guess").build(),
                Evaluation.builder().score(0.2).weaknesses(List.of("No concrete numbers")).build());

        assertEquals("q1-f", followUp.getId());
        assertEquals("q1", followUp.getFollowUpOf());
        assertEquals("What metrics would tell you the requests are wrong?", followUp.getText());
        assertEquals(KUBERNETES, followUp.getTargetSkill());
        assertTrue(followUp.isFollowUp());
    }

    @Test
    void followUpPromptCarriesTheEarlierExchanges() {
        Question earlier = Question.builder()
                .id("q1").text("Explain how a Kubernetes Service routes traffic to pods.")
                .type(InterviewType.TECHNICAL).targetSkill(KUBERNETES).build();
        Answer earlierAnswer = Answer.builder().questionId("q1").rawText("Through kube-proxy and iptables rules.")
                .evaluation(Evaluation.builder().score(0.8).build()).build();
        Question preceding = Question.builder()
                .id("q2").text("How does a Kubernetes Deployment perform a rolling update?")
                .type(InterviewType.TECHNICAL).targetSkill(KUBERNETES).build();
        GenerationContext context = GenerationContext.builder()
                .type(InterviewType.TECHNICAL)
                .candidate(CandidateProfile.builder().build())
                .priorExchanges(List.of(new PriorExchange(earlier, earlierAnswer)))
                .questionCount(1)
                .build();
        when(ollamaClient.generate(anyString())).thenReturn(Optional.of("What controls how many pods are replaced at once?"));

        generator.generateFollowUp(context, preceding,
                Answer.builder().questionId("q2").rawText("It just updates").build(),
                Evaluation.builder().score(0.2).build());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(ollamaClient).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("EARLIER IN THIS INTERVIEW"));
        assertTrue(prompt.getValue().contains("Explain how a Kubernetes Service routes traffic to pods."));
        assertTrue(prompt.getValue().contains("Through kube-proxy and iptables rules."));
        assertTrue(prompt.getValue().contains("It just updates"));
    }
}
