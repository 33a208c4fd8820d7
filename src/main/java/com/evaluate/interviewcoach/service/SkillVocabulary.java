package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.SkillCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only skill reference data: the configured alias table and category assignments.
 * Shared between sessions, never mutated after construction.
 */
public final class SkillVocabulary {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    /** '+' and '#' are kept so that C, C++ and C# stay distinct. */
    private static final Pattern SEPARATORS = Pattern.compile("[\\s._\\-/'\"()\\[\\],:;!?]+");

    private static final List<String> BEHAVIORAL_KEYWORDS = List.of(
            "communication", "leadership", "teamwork", "collaboration", "mentoring", "mentorship",
            "stakeholder", "conflict", "negotiation", "presentation", "ownership", "interpersonal",
            "time management", "problem solving", "adaptability"
    );

    private final Map<String, String> canonicalByKey = new LinkedHashMap<>();
    private final Map<String, String> canonicalByStrippedKey = new LinkedHashMap<>();
    private final Map<String, String> aliasByKey = new LinkedHashMap<>();
    private final Map<String, String> aliasByStrippedKey = new LinkedHashMap<>();
    private final Map<String, SkillCategory> categoryByKey = new LinkedHashMap<>();

    public SkillVocabulary(Map<String, String> aliases, Map<String, SkillCategory> categories) {
        if (categories != null) {
            categories.forEach((name, category) -> {
                registerCanonical(name);
                categoryByKey.put(key(name), category);
            });
        }
        if (aliases != null) {
            aliases.values().forEach(this::registerCanonical);
            aliases.forEach((alias, canonical) -> {
                String canonicalName = clean(canonical);
                // an alias that spells an existing canonical name would shadow it
                if (!canonicalByKey.containsKey(key(alias))) {
                    aliasByKey.putIfAbsent(key(alias), canonicalByKey.get(key(canonicalName)));
                }
                if (!canonicalByStrippedKey.containsKey(strippedKey(alias))) {
                    aliasByStrippedKey.putIfAbsent(strippedKey(alias), canonicalByKey.get(key(canonicalName)));
                }
            });
        }
    }

    public Optional<String> canonicalByKey(String key) {
        return Optional.ofNullable(canonicalByKey.get(key));
    }

    public Optional<String> canonicalByStrippedKey(String strippedKey) {
        return Optional.ofNullable(canonicalByStrippedKey.get(strippedKey));
    }

    public Optional<String> aliasTarget(String key, String strippedKey) {
        String target = aliasByKey.get(key);
        if (target == null) {
            target = aliasByStrippedKey.get(strippedKey);
        }
        return Optional.ofNullable(target);
    }

    public SkillCategory categoryOf(String canonicalName) {
        SkillCategory configured = categoryByKey.get(key(canonicalName));
        if (configured != null) {
            return configured;
        }
        String lower = key(canonicalName);
        return BEHAVIORAL_KEYWORDS.stream().anyMatch(lower::contains)
                ? SkillCategory.BEHAVIORAL
                : SkillCategory.TECHNICAL;
    }

    /** Trimmed with inner whitespace collapsed, original case kept. */
    public static String clean(String mention) {
        return WHITESPACE.matcher(mention.trim()).replaceAll(" ");
    }

    public static String key(String mention) {
        return clean(mention).toLowerCase(Locale.ROOT);
    }

    public static String strippedKey(String mention) {
        return SEPARATORS.matcher(key(mention)).replaceAll("");
    }

    private void registerCanonical(String name) {
        String canonical = clean(name);
        canonicalByKey.putIfAbsent(key(canonical), canonical);
        canonicalByStrippedKey.putIfAbsent(strippedKey(canonical), canonical);
    }
}
