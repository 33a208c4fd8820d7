package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.exception.InsufficientContextException;
import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.InterviewType;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.model.SkillCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Deterministic question bank. Serves on its own when no model is configured and as the
 * fallback of {@link LlmQuestionGenerator}.
 */
@Component
@Slf4j
public class TemplateQuestionGenerator implements QuestionGenerator {

    private static final List<String> TECHNICAL_TEMPLATES = List.of(
            "Explain how you would use %s in a production system. What trade-offs would you consider?",
            "Describe a problem you solved with %s. What was your approach and what would you do differently?",
            "What are the most common pitfalls when working with %s, and how do you avoid them?",
            "How would you explain the core concepts of %s to a new team member?",
            "Walk me through how you would debug a performance issue in a system built on %s."
    );

    private static final List<String> COMPETENCY_TEMPLATES = List.of(
            "Give an example of a project where you applied %s. How did you measure the outcome?",
            "Describe a decision that depended on your knowledge of %s. What evidence did you base it on?",
            "How have you kept your %s skills current, and how did that show in your delivery?",
            "Tell me about a time you had to deliver with %s under a tight deadline. How did you plan the work?"
    );

    private static final String RESPONSIBILITY_TEMPLATE =
            "This role involves the following: %s. How have you handled something similar?";

    private static final String BEHAVIORAL_SKILL_TEMPLATE =
            "Tell me about a situation that tested your %s. What was the situation, what did you do, and what was the result?";

    private static final List<String> BEHAVIORAL_TEMPLATES = List.of(
            "Tell me about a time you disagreed with a teammate. How did you resolve it?",
            "Describe a situation where you had to meet a tight deadline. What did you do?",
            "Give an example of a time you took ownership of a problem outside your responsibilities.",
            "Tell me about a mistake you made at work and what you learned from it.",
            "Describe a time you had to explain a complex topic to a non-technical audience.",
            "Tell me about a time you led a team through a difficult change."
    );

    private static final List<String> GENERAL_TEMPLATES = List.of(
            "Tell me about yourself and what draws you to this role.",
            "What are your career goals for the next few years?",
            "What kind of work environment helps you do your best work?",
            "What achievement are you most proud of, and why?",
            "How do you prioritize when everything seems important?",
            "What do you expect to learn in your next position?"
    );

    @Override
    public List<Question> generate(GenerationContext context) {
        Objects.requireNonNull(context.getType(), "interview type");
        Random random = new Random(context.getSeed());
        int limit = Math.max(1, context.getQuestionCount());

        List<Question> drafts = switch (context.getType()) {
            case TECHNICAL -> gapDriven(context, TECHNICAL_TEMPLATES, random, limit);
            case COMPETENCY -> gapDriven(context, COMPETENCY_TEMPLATES, random, limit);
            case BEHAVIORAL -> behavioral(context, random, limit);
            case GENERAL -> untargeted(InterviewType.GENERAL, GENERAL_TEMPLATES, random, limit);
        };

        List<Question> questions = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            questions.add(drafts.get(i).toBuilder().id("q" + (i + 1)).build());
        }
        log.debug("Generated {} {} questions from templates", questions.size(), context.getType());
        return List.copyOf(questions);
    }

    @Override
    public Question generateFollowUp(GenerationContext context, Question preceding, Answer precedingAnswer,
                                     Evaluation evaluation) {
        if (preceding.isFollowUp()) {
            throw new IllegalArgumentException("Question " + preceding.getId() + " is already a follow-up");
        }
        String feedback = evaluation.getWeaknesses().isEmpty()
                ? "Your last answer needed more depth."
                : "Feedback on your last answer: " + sentence(evaluation.getWeaknesses().get(0));

        String text = preceding.findTargetSkill()
                .map(skill -> "Let's go deeper on " + skill.getCanonicalName() + ". " + feedback
                        + " Can you walk me through a concrete example, step by step?")
                .orElse("Let's revisit that answer. " + feedback
                        + " Can you give a specific example, including the outcome?");

        return Question.builder()
                .id(preceding.getId() + "-f")
                .text(text)
                .type(preceding.getType())
                .targetSkill(preceding.getTargetSkill())
                .followUpOf(preceding.getId())
                .build();
    }

    private List<Question> gapDriven(GenerationContext context, List<String> templates, Random random, int limit) {
        if (!context.hasRequirementOrGaps()) {
            throw new InsufficientContextException(
                    "A " + context.getType().getLabel() + " interview needs job requirements or skill gaps");
        }

        Set<Skill> targets = new LinkedHashSet<>();
        for (GapEntry gap : context.getGaps()) {
            targets.add(gap.getSkill());
        }
        if (context.getRequirement() != null) {
            for (RequiredSkill required : context.getRequirement().getRequiredSkills()) {
                targets.add(required.getSkill());
            }
        }

        List<Question> questions = new ArrayList<>();
        for (Skill skill : targets) {
            if (questions.size() >= limit) {
                break;
            }
            String template = templates.get(random.nextInt(templates.size()));
            String text = template.formatted(skill.getCanonicalName());
            if (context.getCandidate() != null && context.getCandidate().hasSkill(skill)) {
                text = "You list " + skill.getCanonicalName() + " on your resume. " + text;
            }
            questions.add(draft(text, context.getType(), skill));
        }

        if (context.getRequirement() != null) {
            for (String responsibility : context.getRequirement().getResponsibilities()) {
                if (questions.size() >= limit) {
                    break;
                }
                questions.add(draft(RESPONSIBILITY_TEMPLATE.formatted(stripPeriod(responsibility)),
                        context.getType(), null));
            }
        }
        return questions;
    }

    private List<Question> behavioral(GenerationContext context, Random random, int limit) {
        List<Question> questions = new ArrayList<>();
        if (context.getRequirement() != null) {
            for (RequiredSkill required : context.getRequirement().getRequiredSkills()) {
                if (questions.size() >= limit) {
                    break;
                }
                Skill skill = required.getSkill();
                if (skill.getCategory() == SkillCategory.BEHAVIORAL) {
                    questions.add(draft(BEHAVIORAL_SKILL_TEMPLATE.formatted(skill.getCanonicalName().toLowerCase()),
                            InterviewType.BEHAVIORAL, skill));
                }
            }
        }
        questions.addAll(untargeted(InterviewType.BEHAVIORAL, BEHAVIORAL_TEMPLATES, random, limit - questions.size()));
        return questions;
    }

    private List<Question> untargeted(InterviewType type, List<String> bank, Random random, int limit) {
        List<String> shuffled = new ArrayList<>(bank);
        Collections.shuffle(shuffled, random);
        return shuffled.stream()
                .limit(Math.max(0, limit))
                .map(text -> draft(text, type, null))
                .toList();
    }

    private static Question draft(String text, InterviewType type, Skill target) {
        return Question.builder().text(text).type(type).targetSkill(target).build();
    }

    private static String stripPeriod(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static String sentence(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String lowered = Character.toLowerCase(trimmed.charAt(0)) + trimmed.substring(1);
        return lowered.endsWith(".") ? lowered : lowered + ".";
    }
}
