package com.purchasingpower.discovery.service.semantic.impl;

import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.EntityMention;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds where entities are mentioned in a text.
 *
 * <p>Each entity contributes several surface forms: its name, its aliases, and for
 * multi-word names the acronym and the last word. Matching ignores case and only accepts
 * whole words.
 */
public final class MentionDetector {

    static final double NAME_CONFIDENCE = 1.0;
    static final double ALIAS_CONFIDENCE = 0.9;
    static final double ACRONYM_CONFIDENCE = 0.7;
    static final double LAST_WORD_CONFIDENCE = 0.6;

    private static final int MIN_LAST_WORD_LENGTH = 4;

    private MentionDetector() {
    }

    public static List<EntityMention> findMentions(String text, Collection<Entity> entities) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<EntityMention> candidates = new ArrayList<>();
        for (Entity entity : entities) {
            surfaceForms(entity).forEach((form, confidence) -> {
                Matcher matcher = wholeWord(form).matcher(text);
                while (matcher.find()) {
                    candidates.add(EntityMention.builder()
                            .entityId(entity.getId())
                            .entityType(entity.getType())
                            .surfaceForm(text.substring(matcher.start(), matcher.end()))
                            .startPos(matcher.start())
                            .endPos(matcher.end())
                            .confidence(confidence)
                            .build());
                }
            });
        }
        return deduplicate(candidates);
    }

    /**
     * Greedy overlap removal: the most confident candidate wins, then the earliest, then
     * the longest. The result is sorted by start position.
     */
    public static List<EntityMention> deduplicate(List<EntityMention> candidates) {
        List<EntityMention> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(EntityMention::getConfidence).reversed()
                .thenComparingInt(EntityMention::getStartPos)
                .thenComparing(Comparator.comparingInt(EntityMention::length).reversed()));

        List<EntityMention> kept = new ArrayList<>();
        for (EntityMention candidate : ordered) {
            if (kept.stream().noneMatch(candidate::overlaps)) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt(EntityMention::getStartPos));
        return kept;
    }

    /**
     * Surface forms with their confidence; a form reachable several ways keeps the highest.
     */
    static Map<String, Double> surfaceForms(Entity entity) {
        Map<String, Double> forms = new LinkedHashMap<>();
        String name = entity.getName().trim();
        add(forms, name, NAME_CONFIDENCE);
        for (String alias : entity.getAliases()) {
            add(forms, alias, ALIAS_CONFIDENCE);
        }

        String[] words = name.split("\\s+");
        if (words.length > 1) {
            String acronym = Arrays.stream(words)
                    .filter(w -> !w.isEmpty())
                    .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT))
                    .collect(Collectors.joining());
            add(forms, acronym, ACRONYM_CONFIDENCE);

            String lastWord = words[words.length - 1];
            if (lastWord.length() >= MIN_LAST_WORD_LENGTH) {
                add(forms, lastWord, LAST_WORD_CONFIDENCE);
            }
        }
        return forms;
    }

    private static void add(Map<String, Double> forms, String form, double confidence) {
        if (form == null || form.isBlank() || form.length() < 2) {
            return;
        }
        forms.merge(form.trim().toLowerCase(Locale.ROOT), confidence, Math::max);
    }

    private static Pattern wholeWord(String form) {
        return Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(form) + "(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
