package com.evaluate.interviewcoach.service.extraction;

import com.evaluate.interviewcoach.model.EducationLevel;
import com.evaluate.interviewcoach.model.Importance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented rules for résumés and job descriptions.
 *
 * <ul>
 *   <li>{@code Skills:}, {@code Technologies:} and similar lines list skills separated by commas,
 *       semicolons, pipes or bullets.</li>
 *   <li>"proficient in X", "experience with X", "knowledge of X" and "familiarity with X" name
 *       required skills.</li>
 *   <li>A mention is nice-to-have when its line or its section heading says so.</li>
 *   <li>Bullet lines longer than 10 characters are responsibilities.</li>
 * </ul>
 */
@Component
@Slf4j
public class PatternEntityExtractor implements EntityExtractor {

    private static final Pattern SKILL_LINE = Pattern.compile(
            "^\\s*(?:[-*\u2022]\\s*)?(?:technical skills|key skills|core skills|skills|technologies|tech stack|tools)\\s*[:\\-]\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern REQUIREMENT_PHRASE = Pattern.compile(
            "\\b(?:proficient (?:in|with)|proficiency (?:in|with)|experience (?:with|in)|knowledge of|familiarity with|familiar with)\\s+(.+?)(?=[.!?](?:\\s|$)|;|$)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern YEARS = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*\\+?\\s+years?(?:\\s+of)?(?:\\s+[a-z\\-]+)?\\s+experience",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*\u2022]|\\d+[.)])\\s+(.+)$");

    private static final Pattern HEADING = Pattern.compile("^\\s*(?:#+\\s*)?([A-Za-z][A-Za-z /&\\-]{1,60}):?\\s*$");

    private static final Pattern NICE_TO_HAVE = Pattern.compile(
            "nice[\\s\\-]to[\\s\\-]have|\\bpreferred\\b|\\bbonus\\b|\\bplus\\b|\\bdesirable\\b|\\boptional\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SKILL_SECTION = Pattern.compile(
            "skill|requirement|qualification|technolog|stack|tool|nice|prefer|bonus|must",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*(?:[,;|\u2022]|\\band\\b|\\bor\\b)\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_FILLER = Pattern.compile(
            "^(?:the|a|an|modern|strong|solid|good|deep|working|hands-on|some)\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_FILLER = Pattern.compile(
            "(?:\\s+(?:is|are|would|will|be|a|an|highly|strongly|considered))+$", Pattern.CASE_INSENSITIVE);

    /** Checked from the highest level down. */
    private static final Map<EducationLevel, Pattern> EDUCATION = new LinkedHashMap<>();

    static {
        EDUCATION.put(EducationLevel.DOCTORATE, Pattern.compile("\\bph\\.?\\s?d\\b|\\bdoctorate\\b|\\bdoctoral\\b", Pattern.CASE_INSENSITIVE));
        EDUCATION.put(EducationLevel.MASTER, Pattern.compile("\\bmaster'?s?\\b|\\bm\\.?sc?\\b|\\bmba\\b|\\bm\\.eng\\b", Pattern.CASE_INSENSITIVE));
        EDUCATION.put(EducationLevel.BACHELOR, Pattern.compile("\\bbachelor'?s?\\b|\\bb\\.?sc\\b|\\bb\\.s\\.|\\bb\\.a\\.|\\bb\\.?tech\\b|\\bundergraduate degree\\b", Pattern.CASE_INSENSITIVE));
        EDUCATION.put(EducationLevel.ASSOCIATE, Pattern.compile("\\bassociate'?s? degree\\b", Pattern.CASE_INSENSITIVE));
        EDUCATION.put(EducationLevel.HIGH_SCHOOL, Pattern.compile("\\bhigh school\\b|\\bsecondary school\\b|\\bged\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final int MAX_SKILL_WORDS = 4;
    private static final int MIN_RESPONSIBILITY_LENGTH = 10;

    @Override
    public ExtractedEntities extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractedEntities.builder().build();
        }

        List<RequirementMention> mentions = new ArrayList<>();
        List<String> responsibilities = new ArrayList<>();
        List<String> segments = new ArrayList<>();
        double years = 0.0;
        boolean niceSection = false;
        boolean skillSection = false;

        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            segments.add(line);

            Matcher heading = HEADING.matcher(line);
            if (heading.matches() && (line.endsWith(":") || line.startsWith("#"))) {
                niceSection = NICE_TO_HAVE.matcher(heading.group(1)).find();
                skillSection = SKILL_SECTION.matcher(heading.group(1)).find();
                continue;
            }

            Importance importance = niceSection || NICE_TO_HAVE.matcher(line).find()
                    ? Importance.NICE_TO_HAVE
                    : Importance.MUST_HAVE;

            Matcher bullet = BULLET.matcher(line);
            boolean isBullet = bullet.matches();
            String body = isBullet ? bullet.group(1).strip() : line;

            Matcher skillLine = SKILL_LINE.matcher(line);
            Matcher phrase = REQUIREMENT_PHRASE.matcher(line);
            if (skillLine.matches()) {
                addItems(skillLine.group(1), importance, mentions);
            } else if (phrase.find()) {
                do {
                    addItems(phrase.group(1), importance, mentions);
                } while (phrase.find());
            } else if (skillSection && isShortList(body)) {
                addItems(body, importance, mentions);
            } else if (isBullet && body.length() > MIN_RESPONSIBILITY_LENGTH) {
                responsibilities.add(body);
            }

            Matcher yearsMatcher = YEARS.matcher(line);
            while (yearsMatcher.find()) {
                years = Math.max(years, Double.parseDouble(yearsMatcher.group(1)));
            }
        }

        ExtractedEntities entities = ExtractedEntities.builder()
                .mentions(List.copyOf(mentions))
                .experienceYears(years)
                .educationLevel(education(text))
                .responsibilities(List.copyOf(responsibilities))
                .rawSegments(List.copyOf(segments))
                .build();
        log.debug("Extracted {} skill mentions, {} responsibilities, {} years, education {}",
                mentions.size(), responsibilities.size(), years, entities.getEducationLevel());
        return entities;
    }

    private static void addItems(String list, Importance importance, List<RequirementMention> into) {
        String withoutMarkers = NICE_TO_HAVE.matcher(list).replaceAll(" ");
        for (String item : LIST_SEPARATOR.split(withoutMarkers)) {
            String trimmed = LEADING_FILLER.matcher(item.strip()).replaceFirst("")
                    .replaceAll("^[\\s:()\\-]+|[\\s:()\\-.]+$", "");
            String cleaned = TRAILING_FILLER.matcher(trimmed).replaceFirst("").strip();
            if (cleaned.isEmpty() || cleaned.split("\\s+").length > MAX_SKILL_WORDS) {
                continue;
            }
            if (!Character.isLetterOrDigit(cleaned.charAt(0))) {
                continue;
            }
            into.add(RequirementMention.of(cleaned, importance));
        }
    }

    private static boolean isShortList(String body) {
        if (body.matches(".*[.!?](\\s.*)?$")) {
            return false;
        }
        for (String item : LIST_SEPARATOR.split(body)) {
            if (item.isBlank() || item.strip().split("\\s+").length > MAX_SKILL_WORDS) {
                return false;
            }
        }
        return true;
    }

    private static EducationLevel education(String text) {
        for (Map.Entry<EducationLevel, Pattern> entry : EDUCATION.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return EducationLevel.UNKNOWN;
    }
}
