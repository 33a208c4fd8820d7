package com.evaluate.interviewcoach.service.generation;

import com.evaluate.interviewcoach.exception.InsufficientContextException;
import com.evaluate.interviewcoach.model.Answer;
import com.evaluate.interviewcoach.model.Evaluation;
import com.evaluate.interviewcoach.model.GapEntry;
import com.evaluate.interviewcoach.model.Question;
import com.evaluate.interviewcoach.model.RequiredSkill;
import com.evaluate.interviewcoach.model.Skill;
import com.evaluate.interviewcoach.service.OllamaClient;
import com.evaluate.interviewcoach.service.PromptFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Primary
@ConditionalOnProperty(prefix = "interview.llm", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class LlmQuestionGenerator implements QuestionGenerator {

    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d+)[.)]\\s*(.+)$");
    private static final String[] PREFIXES = {"Question:", "Q:", "Follow-up:", "Follow up:"};

    private final OllamaClient ollamaClient;
    private final PromptFactory promptFactory;
    private final TemplateQuestionGenerator fallback;

    @Override
    public List<Question> generate(GenerationContext context) {
        if (context.getType().isGapDriven() && !context.hasRequirementOrGaps()) {
            throw new InsufficientContextException(
                    "A " + context.getType().getLabel() + " interview needs job requirements or skill gaps");
        }

        Optional<String> response = ollamaClient.generate(promptFactory.questionPrompt(context));
        List<String> texts = response.map(this::parseNumberedList).orElse(List.of());
        if (texts.isEmpty()) {
            log.warn("Model produced no usable questions, falling back to templates");
            return fallback.generate(context);
        }

        Set<Skill> targets = targets(context);
        List<Question> questions = new ArrayList<>();
        for (String text : texts) {
            if (questions.size() >= Math.max(1, context.getQuestionCount())) {
                break;
            }
            questions.add(Question.builder()
                    .id("q" + (questions.size() + 1))
                    .text(text)
                    .type(context.getType())
                    .targetSkill(mentionedSkill(text, targets))
                    .build());
        }
        return List.copyOf(questions);
    }

    @Override
    public Question generateFollowUp(GenerationContext context, Question preceding, Answer precedingAnswer,
                                     Evaluation evaluation) {
        if (preceding.isFollowUp()) {
            throw new IllegalArgumentException("Question " + preceding.getId() + " is already a follow-up");
        }
        String prompt = promptFactory.followUpPrompt(context, preceding, precedingAnswer, evaluation);
        Optional<String> text = ollamaClient.generate(prompt)
                .map(LlmQuestionGenerator::firstLine)
                .filter(line -> line.length() > 10);
        if (text.isEmpty()) {
            return fallback.generateFollowUp(context, preceding, precedingAnswer, evaluation);
        }
        return Question.builder()
                .id(preceding.getId() + "-f")
                .text(text.get())
                .type(preceding.getType())
                .targetSkill(preceding.getTargetSkill())
                .followUpOf(preceding.getId())
                .build();
    }

    List<String> parseNumberedList(String response) {
        List<String> questions = new ArrayList<>();
        for (String line : response.split("\n")) {
            Matcher matcher = NUMBERED.matcher(line);
            if (matcher.matches()) {
                String text = stripPrefix(matcher.group(2).trim());
                if (text.length() > 10) {
                    questions.add(text);
                }
            }
        }
        return questions;
    }

    private static Set<Skill> targets(GenerationContext context) {
        Set<Skill> targets = new LinkedHashSet<>();
        for (GapEntry gap : context.getGaps()) {
            targets.add(gap.getSkill());
        }
        if (context.getRequirement() != null) {
            for (RequiredSkill required : context.getRequirement().getRequiredSkills()) {
                targets.add(required.getSkill());
            }
        }
        return targets;
    }

    private static Skill mentionedSkill(String text, Set<Skill> targets) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Skill skill : targets) {
            if (lower.contains(skill.getCanonicalName().toLowerCase(Locale.ROOT))) {
                return skill;
            }
            for (String alias : skill.getAliases()) {
                if (lower.contains(alias.toLowerCase(Locale.ROOT))) {
                    return skill;
                }
            }
        }
        return null;
    }

    private static String firstLine(String response) {
        for (String line : response.split("\n")) {
            if (!line.isBlank()) {
                return stripPrefix(line.trim());
            }
        }
        return "";
    }

    private static String stripPrefix(String text) {
        String clean = text;
        for (String prefix : PREFIXES) {
            if (clean.startsWith(prefix)) {
                clean = clean.substring(prefix.length()).trim();
            }
        }
        return clean;
    }
}
