package com.purchasingpower.discovery.service.temporal;

import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Event;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.TemporalCluster;
import com.purchasingpower.discovery.model.TemporalCorrelation;

import java.util.Collection;
import java.util.List;

/**
 * Correlates the daily event series of entity pairs across a range of lags.
 */
public interface TemporalRelationshipAnalyzer {

    /**
     * Relationships for the significant correlations: CORRELATES_WITH for simultaneous
     * movement, INFLUENCED_BY (follower to leader) when one series lags the other.
     */
    List<Relationship> analyzeTemporalPatterns(Collection<Entity> entities, Collection<Event> events);

    /**
     * Every pair correlation that could be computed, significant or not.
     */
    List<TemporalCorrelation> computeCorrelations(Collection<Entity> entities, Collection<Event> events);

    List<TemporalCluster> detectTemporalClusters(Collection<Event> events, int windowDays);

    List<TemporalCluster> detectTemporalClusters(Collection<Event> events);
}
