package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.CandidateProfile;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.JobRequirement;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.service.generation.GenerationContext;
import com.evaluate.interviewcoach.service.generation.PriorExchange;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class PromptFactory {

    private static final int EXCERPT_LENGTH = 200;

    public String questionPrompt(GenerationContext context) {
        String gaps = context.getGaps().stream()
                .filter(g -> !g.isCandidateHasSkill())
                .map(g -> g.getSkill().getCanonicalName() + " (" + g.getImportance().name().toLowerCase() + ")")
                .collect(Collectors.joining(", "));

        return """
                You are an experienced %s interviewer.
                Generate %d %s interview questions based on the following context.

                CANDIDATE BACKGROUND:
                %s

                JOB REQUIREMENTS:
                %s

                SKILL GAPS TO COVER:
                %s
                %s
                Rules for generating questions:
                %s

                Please generate exactly %d questions, formatted as a numbered list (1-%d).
                Just provide the questions without any additional text or explanations.
                """.formatted(
                context.getType().getLabel().toLowerCase(),
                context.getQuestionCount(),
                context.getType().getLabel().toLowerCase(),
                describe(context.getCandidate()),
                describe(context.getRequirement()),
                gaps.isEmpty() ? "None identified" : gaps,
                earlier(context.getPriorExchanges(), "\nALREADY ASKED (do not repeat these):\n"),
                rules(context.getType()),
                context.getQuestionCount(),
                context.getQuestionCount());
    }

    public String followUpPrompt(GenerationContext context, Question preceding, Answer answer, Evaluation evaluation) {
        return """
                You are interviewing a candidate%s.
                CANDIDATE BACKGROUND: %s
                %s
                The candidate gave a weak answer. Ask ONE follow-up question that targets the gap
                without repeating anything asked earlier.

                Question: %s
                Answer: %s
                Weaknesses: %s

                Respond with the follow-up question only.
                """.formatted(
                preceding.findTargetSkill().map(s -> " on " + s.getCanonicalName()).orElse(""),
                describe(context.getCandidate()),
                earlier(context.getPriorExchanges(), "\nEARLIER IN THIS INTERVIEW:\n"),
                preceding.getText(),
                answer.getRawText().isBlank() ? "(no response)" : answer.getRawText(),
                String.join("; ", evaluation.getWeaknesses()));
    }

    public String evaluationPrompt(Question question, Answer answer, CandidateProfile profile) {
        String claimed = question.findTargetSkill()
                .map(skill -> profile != null && profile.hasSkill(skill)
                        ? "The candidate claims " + skill.getCanonicalName() + " on their resume."
                        : "The candidate does not list " + skill.getCanonicalName() + " on their resume.")
                .orElse("");

        return """
                You are a STRICT interviewer for %s questions. Never give undeserved scores.

                Question: %s
                Answer: %s
                %s

                FIRST: RELEVANCE CHECK
                - Does the answer actually address the question asked? If not, score 0-1 immediately.
                - Is the answer coherent? If it's gibberish or unrelated rambling, score 0-1 immediately.

                SCORING RUBRIC:
                0-1: Gibberish or off-topic
                2-3: Fundamentally wrong
                4-5: On-topic but superficial
                6-7: Covers the basics but lacks detail
                8-9: Accurate, specific and well-structured
                10: Comprehensive and insightful

                Rate relevance, completeness and clarity separately as well, each from 0 to 10.

                FORMAT YOUR RESPONSE:
                Score: [0-10]
                Relevance: [0-10]
                Completeness: [0-10]
                Clarity: [0-10]
                Strengths:
                - [strength]
                Weaknesses:
                - [weakness]
                """.formatted(
                question.getType().getLabel().toLowerCase(),
                question.getText(),
                answer.getRawText(),
                claimed);
    }

    private static String rules(InterviewType type) {
        return switch (type) {
            case TECHNICAL -> """
                    1. Test practical problem-solving with the listed skills
                    2. Include system design and architecture where relevant
                    3. Focus on the skill gaps first
                    4. Match the complexity to the candidate's experience level""";
            case BEHAVIORAL -> """
                    1. Questions should follow the STAR format
                    2. Focus on past experiences and specific situations
                    3. Cover teamwork, leadership and conflict resolution""";
            case COMPETENCY -> """
                    1. Focus on the specific competencies required for the role
                    2. Cover delivery, communication and decision-making
                    3. Make questions measurable and evidence-based""";
            case GENERAL -> """
                    1. Understand the candidate's motivations and goals
                    2. Cover work style and career aspirations
                    3. Keep questions open-ended but specific""";
        };
    }

    private static String describe(CandidateProfile candidate) {
        if (candidate == null) {
            return "Not provided";
        }
        return "Skills: " + names(candidate.getSkills().stream().toList())
                + ". Experience: " + candidate.getExperienceYears() + " years"
                + ". Education: " + candidate.getEducationLevel().name().toLowerCase();
    }

    private static String describe(JobRequirement requirement) {
        if (requirement == null || requirement.isEmpty()) {
            return "Not provided";
        }
        List<Skill> skills = requirement.getRequiredSkills().stream().map(RequiredSkill::getSkill).toList();
        return "Requirements: " + names(skills)
                + ". Responsibilities: " + String.join("; ", requirement.getResponsibilities());
    }

    private static String earlier(List<PriorExchange> exchanges, String heading) {
        if (exchanges.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder(heading);
        for (PriorExchange exchange : exchanges) {
            String answer = exchange.getAnswer().getRawText();
            text.append("- Q: ").append(exchange.getQuestion().getText()).append('\n')
                    .append("  A: ").append(answer.isBlank() ? "(no response)" : abbreviate(answer));
            if (exchange.getAnswer().isEvaluated()) {
                text.append(" [score ").append(exchange.getAnswer().getEvaluation().getScore()).append(']');
            }
            text.append('\n');
        }
        return text.toString();
    }

    private static String abbreviate(String answer) {
        return answer.length() <= EXCERPT_LENGTH ? answer : answer.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static String names(List<Skill> skills) {
        return skills.stream().map(Skill::getCanonicalName).collect(Collectors.joining(", "));
    }
}
