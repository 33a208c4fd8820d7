package com.evaluate.interviewcoach.service;

import com.evaluate.interviewcoach.model.Skill;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns free-text skill mentions into canonical {@link Skill}s.
 *
 * <p>A mention resolves, in order, by case-insensitive match against known canonical names
 * and already seen mentions, by punctuation-stripped match against the same, then through the
 * configured alias table. Anything left becomes a new canonical skill named as first written.
 * Normalizing the output again yields the same set.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SkillNormalizer {

    private final SkillVocabulary vocabulary;

    public Set<Skill> normalize(List<String> rawMentions) {
        return normalize(rawMentions, List.of());
    }

    /**
     * Normalizes mentions so that they also resolve onto {@code known} skills, which keeps
     * skills extracted from different documents comparable.
     */
    public Set<Skill> normalize(List<String> rawMentions, Collection<Skill> known) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(resolveAll(rawMentions, known).values()));
    }

    public Set<Skill> normalizeSkills(Collection<Skill> skills) {
        return normalize(flatten(skills));
    }

    /**
     * Maps every distinct non-blank mention to its canonical skill, in first-mention order.
     */
    public Map<String, Skill> resolveAll(List<String> rawMentions, Collection<Skill> known) {
        Resolution resolution = new Resolution();
        if (known != null) {
            for (Skill skill : known) {
                resolution.seed(skill);
            }
        }

        Map<String, Skill> resolved = new LinkedHashMap<>();
        if (rawMentions == null) {
            return resolved;
        }
        for (String mention : rawMentions) {
            if (mention == null || mention.isBlank()) {
                log.debug("Skipping blank skill mention");
                continue;
            }
            String cleaned = SkillVocabulary.clean(mention);
            resolution.resolve(cleaned);
        }
        for (String mention : rawMentions) {
            if (mention == null || mention.isBlank()) {
                continue;
            }
            String cleaned = SkillVocabulary.clean(mention);
            resolved.putIfAbsent(cleaned, resolution.skillFor(cleaned));
        }
        return resolved;
    }

    private static List<String> flatten(Collection<Skill> skills) {
        return skills.stream()
                .flatMap(skill -> Stream.concat(Stream.of(skill.getCanonicalName()), skill.getAliases().stream()))
                .toList();
    }

    /** Per-call resolution state; the vocabulary itself is never written. */
    private final class Resolution {

        private final Map<String, String> canonicalByKey = new HashMap<>();
        private final Map<String, String> canonicalByStrippedKey = new HashMap<>();
        private final Map<String, String> canonicalByMention = new HashMap<>();
        private final Map<String, Set<String>> aliasesByCanonical = new LinkedHashMap<>();
        private final Map<String, Skill> seeded = new HashMap<>();

        void seed(Skill skill) {
            String canonical = skill.getCanonicalName();
            seeded.put(canonical, skill);
            index(canonical, canonical);
            for (String alias : skill.getAliases()) {
                index(SkillVocabulary.clean(alias), canonical);
            }
        }

        void resolve(String mention) {
            String canonical = lookup(mention);
            canonicalByMention.put(mention, canonical);
            index(mention, canonical);
            aliasesByCanonical.computeIfAbsent(canonical, c -> new LinkedHashSet<>()).add(mention);
        }

        Skill skillFor(String mention) {
            String canonical = canonicalByMention.get(mention);
            Set<String> aliases = new LinkedHashSet<>();
            Skill seededSkill = seeded.get(canonical);
            if (seededSkill != null) {
                aliases.addAll(seededSkill.getAliases());
            }
            aliases.addAll(aliasesByCanonical.getOrDefault(canonical, Set.of()));
            return Skill.builder()
                    .canonicalName(canonical)
                    .aliases(Collections.unmodifiableSet(aliases))
                    .category(seededSkill != null ? seededSkill.getCategory() : vocabulary.categoryOf(canonical))
                    .build();
        }

        private String lookup(String mention) {
            String key = SkillVocabulary.key(mention);
            String strippedKey = SkillVocabulary.strippedKey(mention);

            String canonical = canonicalByKey.get(key);
            if (canonical == null) {
                canonical = vocabulary.canonicalByKey(key).orElse(null);
            }
            if (canonical == null) {
                canonical = canonicalByStrippedKey.get(strippedKey);
            }
            if (canonical == null && !strippedKey.isEmpty()) {
                canonical = vocabulary.canonicalByStrippedKey(strippedKey).orElse(null);
            }
            if (canonical == null) {
                canonical = vocabulary.aliasTarget(key, strippedKey).orElse(null);
            }
            if (canonical == null) {
                log.debug("New canonical skill '{}'", mention);
                canonical = mention;
            }
            return canonical;
        }

        private void index(String mention, String canonical) {
            canonicalByKey.putIfAbsent(SkillVocabulary.key(mention), canonical);
            String strippedKey = SkillVocabulary.strippedKey(mention);
            if (!strippedKey.isEmpty()) {
                canonicalByStrippedKey.putIfAbsent(strippedKey, canonical);
            }
        }
    }
}
