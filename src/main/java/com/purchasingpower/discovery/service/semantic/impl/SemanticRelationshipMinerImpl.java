package com.purchasingpower.discovery.service.semantic.impl;

import com.google.common.collect.Lists;
import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.configuration.AsyncConfig;
import com.purchasingpower.discovery.model.Document;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.EntityMention;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.TemporalAspect;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.semantic.SemanticRelationshipMiner;
import com.purchasingpower.discovery.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class SemanticRelationshipMinerImpl implements SemanticRelationshipMiner {

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?](?=\\s|$)|\\n");
    private static final Pattern NEGATION = Pattern.compile("\\b(?:not|never|no\\s+longer)\\b|n't\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEDGE = Pattern.compile(
            "\\b(?:might|may|could|seems?|appears?|possibly|perhaps|probably|likely|reportedly|allegedly)\\b",
            Pattern.CASE_INSENSITIVE);

    private final DiscoveryProperties properties;
    private final Executor executor;

    public SemanticRelationshipMinerImpl(DiscoveryProperties properties,
                                         @Qualifier(AsyncConfig.DISCOVERY_EXECUTOR) Executor executor) {
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public List<EntityMention> findEntityMentions(String text, Collection<Entity> entities) {
        return MentionDetector.findMentions(truncate(text), EntityIndex.of(entities).all());
    }

    @Override
    public List<Relationship> mineFromText(String text, Collection<Entity> entities, Map<String, Object> documentMetadata) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String analysed = truncate(text);
        EntityIndex index = EntityIndex.of(entities);
        List<EntityMention> mentions = MentionDetector.findMentions(analysed, index.all());
        if (mentions.size() < 2) {
            log.debug("Fewer than two entity mentions in text, nothing to mine");
            return List.of();
        }

        DiscoveryProperties.Semantic config = properties.getSemantic();
        List<Relationship> relationships = new ArrayList<>();
        for (int i = 0; i + 1 < mentions.size(); i++) {
            EntityMention first = mentions.get(i);
            EntityMention second = mentions.get(i + 1);
            if (first.getEntityId().equals(second.getEntityId())) {
                continue;
            }
            if (second.getStartPos() - first.getEndPos() > config.getMaxMentionGap()) {
                continue;
            }
            String between = analysed.substring(first.getEndPos(), second.getStartPos());
            if (SENTENCE_BREAK.matcher(between).find() || NEGATION.matcher(between).find()) {
                continue;
            }

            extract(analysed, between, first, second, index, documentMetadata)
                    .filter(r -> r.getConfidence() >= config.getMinConfidence())
                    .ifPresent(relationships::add);
        }

        List<Relationship> merged = mergeDuplicates(relationships);
        log.debug("Mined {} relationships from {} mentions in \"{}\"",
                merged.size(), mentions.size(), LogFormat.truncate(analysed, 80));
        return merged;
    }

    private Optional<Relationship> extract(String text, String between, EntityMention first, EntityMention second,
                                           EntityIndex index, Map<String, Object> documentMetadata) {
        for (PhrasePattern phrase : PhrasePattern.DEFAULTS) {
            Optional<String> match = phrase.find(between);
            if (match.isEmpty()) {
                continue;
            }

            EntityMention subject = phrase.reversed() ? second : first;
            EntityMention object = phrase.reversed() ? first : second;
            Optional<Entity> source = index.get(subject.getEntityId());
            Optional<Entity> target = index.get(object.getEntityId());
            if (source.isEmpty() || target.isEmpty()) {
                return Optional.empty();
            }

            String sentence = sentenceAround(text, first.getStartPos(), second.getEndPos());
            double confidence = properties.getSemantic().getBaseConfidence();
            // Only hedges inside the statement itself count, not elsewhere in the sentence
            String statement = text.substring(first.getStartPos(), second.getEndPos());
            if (HEDGE.matcher(statement).find()) {
                confidence *= properties.getSemantic().getHedgePenalty();
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("pattern", phrase.name());
            metadata.put("matched_phrase", match.get().trim());
            if (documentMetadata != null && !documentMetadata.isEmpty()) {
                metadata.put("document", new LinkedHashMap<>(documentMetadata));
            }

            return Optional.of(Relationship.builder()
                    .source(source.get())
                    .target(target.get())
                    .relationshipType(phrase.type())
                    .direction(phrase.bidirectional() ? RelationshipDirection.BIDIRECTIONAL : RelationshipDirection.UNIDIRECTIONAL)
                    .confidence(confidence)
                    .evidence(List.of(sentence))
                    .temporalAspect(phrase.isPastTense(match.get()) ? TemporalAspect.PAST : TemporalAspect.PRESENT)
                    .metadata(metadata)
                    .build());
        }
        return Optional.empty();
    }

    /**
     * The sentence containing {@code [from, to)}, trimmed.
     */
    private static String sentenceAround(String text, int from, int to) {
        int start = 0;
        Matcher before = SENTENCE_BREAK.matcher(text.substring(0, from));
        while (before.find()) {
            start = before.end();
        }
        int end = text.length();
        Matcher after = SENTENCE_BREAK.matcher(text);
        if (after.find(to)) {
            end = after.end();
        }
        return text.substring(start, end).trim();
    }

    /**
     * Keeps one relationship per source, target and type: the most confident, carrying the
     * distinct evidence of all of them.
     */
    private static List<Relationship> mergeDuplicates(List<Relationship> relationships) {
        Map<Relationship.Key, Relationship> merged = new LinkedHashMap<>();
        for (Relationship relationship : relationships) {
            merged.merge(relationship.key(), relationship, (kept, candidate) -> {
                Relationship winner = candidate.getConfidence() > kept.getConfidence() ? candidate : kept;
                Set<String> evidence = new LinkedHashSet<>(kept.getEvidence());
                evidence.addAll(candidate.getEvidence());
                return winner.toBuilder().evidence(new ArrayList<>(evidence)).build();
            });
        }
        return new ArrayList<>(merged.values());
    }

    /**
     * Blocks until every document is mined. Not for use from a discovery executor thread;
     * compose {@link #extractFromDocumentsAsync} there instead.
     */
    @Override
    public List<Relationship> extractFromDocuments(Collection<Document> documents, Collection<Entity> entities) {
        return extractFromDocumentsAsync(documents, entities).join();
    }

    @Override
    public CompletableFuture<List<Relationship>> extractFromDocumentsAsync(Collection<Document> documents,
                                                                           Collection<Entity> entities) {
        if (documents == null || documents.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<Entity> snapshot = EntityIndex.of(entities).all();
        int documentCount = documents.size();

        // One batch in flight at a time; the next starts when the previous completes
        CompletableFuture<List<Relationship>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (List<Document> batch : Lists.partition(new ArrayList<>(documents), properties.getSemantic().getBatchSize())) {
            chain = chain.thenCompose(found -> mineBatch(batch, snapshot).thenApply(mined -> {
                found.addAll(mined);
                return found;
            }));
        }

        return chain.thenApply(all -> {
            List<Relationship> merged = mergeDuplicates(all);
            log.info("Mined {} relationships from {} documents", merged.size(), documentCount);
            return merged;
        });
    }

    private CompletableFuture<List<Relationship>> mineBatch(List<Document> batch, List<Entity> entities) {
        List<CompletableFuture<List<Relationship>>> futures = batch.stream()
                .map(document -> submit(document, entities))
                .toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(done -> futures.stream()
                        .flatMap(future -> future.join().stream())
                        .toList());
    }

    private CompletableFuture<List<Relationship>> submit(Document document, List<Entity> entities) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> mineDocument(document, entities), executor)
                    .exceptionally(ex -> {
                        log.warn("Skipping document {}: {}", document.getId(), ex.getMessage());
                        return List.of();
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Skipping document {}: discovery executor rejected it ({})", document.getId(), e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private List<Relationship> mineDocument(Document document, List<Entity> entities) {
        Map<String, Object> documentMetadata = new LinkedHashMap<>(document.getMetadata());
        documentMetadata.put("document_id", document.getId());
        if (document.getSource() != null) {
            documentMetadata.put("document_source", document.getSource());
        }

        return mineFromText(document.getText(), entities, documentMetadata).stream()
                .map(relationship -> {
                    Map<String, Object> metadata = new LinkedHashMap<>(relationship.getMetadata());
                    metadata.put("document_id", document.getId());
                    metadata.put("document_source", document.getSource() != null ? document.getSource() : "unknown");
                    return relationship.toBuilder().metadata(metadata).build();
                })
                .toList();
    }

    @Override
    public Optional<String> getRelationshipContext(String text, Relationship relationship, List<EntityMention> mentions) {
        if (text == null || mentions == null) {
            return Optional.empty();
        }
        String sourceId = relationship.getSource().getId();
        String targetId = relationship.getTarget().getId();

        EntityMention bestSource = null;
        EntityMention bestTarget = null;
        int bestDistance = Integer.MAX_VALUE;
        for (EntityMention s : mentions) {
            if (!s.getEntityId().equals(sourceId)) {
                continue;
            }
            for (EntityMention t : mentions) {
                if (!t.getEntityId().equals(targetId)) {
                    continue;
                }
                int distance = Math.abs(s.getStartPos() - t.getStartPos());
                if (distance < bestDistance) {
                    bestDistance = distance;
                    bestSource = s;
                    bestTarget = t;
                }
            }
        }
        if (bestSource == null) {
            return Optional.empty();
        }

        int window = properties.getSemantic().getContextWindow();
        int start = Math.max(0, Math.min(bestSource.getStartPos(), bestTarget.getStartPos()) - window);
        int end = Math.min(text.length(), Math.max(bestSource.getEndPos(), bestTarget.getEndPos()) + window);
        return Optional.of(text.substring(start, end).trim());
    }

    private String truncate(String text) {
        int max = properties.getSemantic().getMaxTextLength();
        if (text == null || text.length() <= max) {
            return text;
        }
        log.debug("Truncating text of {} chars to {}", text.length(), max);
        return text.substring(0, max);
    }
}
