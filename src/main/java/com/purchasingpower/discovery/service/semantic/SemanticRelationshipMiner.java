package com.purchasingpower.discovery.service.semantic;

import com.purchasingpower.discovery.model.Document;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.EntityMention;
import com.purchasingpower.discovery.model.Relationship;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Extracts relationships stated in free text between entities mentioned in it.
 */
public interface SemanticRelationshipMiner {

    /**
     * @param documentMetadata provenance copied to {@code metadata["document"]} of every result; may be null
     */
    List<Relationship> mineFromText(String text, Collection<Entity> entities, Map<String, Object> documentMetadata);

    /**
     * Mines every document in parallel batches. Results are tagged with
     * {@code document_id} and {@code document_source}; a failing document is skipped.
     */
    List<Relationship> extractFromDocuments(Collection<Document> documents, Collection<Entity> entities);

    /**
     * Non-blocking form of {@link #extractFromDocuments}. Batches are chained on the discovery
     * executor without any pool thread waiting on another, so it is safe to compose from tasks
     * already running there.
     */
    CompletableFuture<List<Relationship>> extractFromDocumentsAsync(Collection<Document> documents,
                                                                    Collection<Entity> entities);

    /**
     * Non-overlapping entity mentions, ordered by position.
     */
    List<EntityMention> findEntityMentions(String text, Collection<Entity> entities);

    /**
     * Text surrounding the closest pair of mentions of the relationship's two endpoints.
     */
    Optional<String> getRelationshipContext(String text, Relationship relationship, List<EntityMention> mentions);
}
