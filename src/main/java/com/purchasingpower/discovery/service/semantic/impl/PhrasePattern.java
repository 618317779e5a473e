package com.purchasingpower.discovery.service.semantic.impl;

import com.purchasingpower.discovery.model.RelationshipType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A relationship phrase looked for between two mentions.
 *
 * @param reversed      the second mention is the subject ("X is impacted by Y" means Y impacts X)
 * @param bidirectional the phrase reads the same both ways
 */
record PhrasePattern(String name, RelationshipType type, Pattern pattern, boolean reversed, boolean bidirectional) {

    private static final Set<String> PAST_AUXILIARIES = Set.of("was", "were", "been", "had");
    private static final Set<String> PAST_VERBS = Set.of(
            "managed", "led", "supervised", "oversaw", "headed", "owned", "reported", "worked",
            "collaborated", "partnered", "impacted", "affected", "influenced", "depended", "relied");

    /**
     * Ordered: the first pattern that matches decides the relationship.
     */
    static final List<PhrasePattern> DEFAULTS = List.of(
            of("passive_impact", RelationshipType.IMPACTS,
                    "\\b(?:is|are|was|were|has been|have been|being)\\s+(?:impacted|affected|influenced)\\s+by\\b", true, false),
            of("reports_to", RelationshipType.REPORTS_TO,
                    "\\b(?:reports|reported|reporting)\\s+to\\b|\\b(?:works|worked|working)\\s+for\\b", false, false),
            of("responsible_for", RelationshipType.RESPONSIBLE_FOR,
                    "\\bresponsible\\s+for\\b", false, false),
            of("works_with", RelationshipType.WORKS_WITH,
                    "\\b(?:works|work|worked|working|collaborates|collaborated|collaborating)\\s+with\\b", false, true),
            of("partners_with", RelationshipType.COLLABORATES_WITH,
                    "\\b(?:partners|partnered|partnering)\\s+with\\b", false, true),
            of("manages", RelationshipType.MANAGES,
                    "\\b(?:manages|managed|managing|leads|led|leading|supervises|supervised|oversees|oversaw|heads|headed)\\b", false, false),
            of("owns", RelationshipType.OWNS,
                    "\\b(?:owns|owned)\\b", false, false),
            of("impacts", RelationshipType.IMPACTS,
                    "\\b(?:impacts|impacted|affects|affected|influences|influenced)\\b", false, false),
            of("depends_on", RelationshipType.DEPENDS_ON,
                    "\\b(?:depends|depended|relies|relied)\\s+on\\b", false, false),
            of("related_to", RelationshipType.RELATED_TO,
                    "\\b(?:is|are|was|were)\\s+(?:related|connected|linked)\\s+to\\b", false, true));

    private static PhrasePattern of(String name, RelationshipType type, String regex, boolean reversed, boolean bidirectional) {
        return new PhrasePattern(name, type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), reversed, bidirectional);
    }

    Optional<String> find(String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * Whether the matched phrase is in the past tense. Passive phrases carry a participle
     * ("impacted") in every tense, so only their auxiliary counts.
     */
    boolean isPastTense(String matchedPhrase) {
        for (String token : matchedPhrase.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (PAST_AUXILIARIES.contains(token)) {
                return true;
            }
            if (!reversed && PAST_VERBS.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
