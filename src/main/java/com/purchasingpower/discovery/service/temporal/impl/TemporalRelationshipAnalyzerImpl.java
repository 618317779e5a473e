package com.purchasingpower.discovery.service.temporal.impl;

import com.purchasingpower.discovery.config.DiscoveryProperties;
import com.purchasingpower.discovery.model.Entity;
import com.purchasingpower.discovery.model.Event;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.model.RelationshipDirection;
import com.purchasingpower.discovery.model.RelationshipStrength;
import com.purchasingpower.discovery.model.RelationshipType;
import com.purchasingpower.discovery.model.TemporalAspect;
import com.purchasingpower.discovery.model.TemporalCluster;
import com.purchasingpower.discovery.model.TemporalCorrelation;
import com.purchasingpower.discovery.service.EntityIndex;
import com.purchasingpower.discovery.service.temporal.TemporalRelationshipAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

@Slf4j
@Service
@RequiredArgsConstructor
public class TemporalRelationshipAnalyzerImpl implements TemporalRelationshipAnalyzer {

    private static final double COMPONENT_FLOOR = 0.01;

    private final DiscoveryProperties properties;

    @Override
    public List<Relationship> analyzeTemporalPatterns(Collection<Entity> entities, Collection<Event> events) {
        DiscoveryProperties.Temporal config = properties.getTemporal();
        List<Relationship> relationships = computeCorrelations(entities, events).stream()
                .filter(c -> c.isSignificant(config.getMinCorrelation(), config.getMinCausality()))
                .map(this::toRelationship)
                .toList();

        log.info("Found {} significant temporal relationships", relationships.size());
        return relationships;
    }

    @Override
    public List<TemporalCorrelation> computeCorrelations(Collection<Entity> entities, Collection<Event> events) {
        DiscoveryProperties.Temporal config = properties.getTemporal();
        if (events == null || events.isEmpty()) {
            log.debug("No events supplied, skipping temporal analysis");
            return List.of();
        }

        EntityIndex index = EntityIndex.of(entities);
        Map<String, List<Event>> byEntity = new LinkedHashMap<>();
        for (Event event : events) {
            if (event.getTimestamp() == null || !index.contains(event.getEntityId())) {
                continue;
            }
            byEntity.computeIfAbsent(event.getEntityId(), id -> new ArrayList<>()).add(event);
        }

        Map<Entity, DailySeries> series = new LinkedHashMap<>();
        for (Entity entity : index.all()) {
            List<Event> entityEvents = byEntity.getOrDefault(entity.getId(), List.of());
            if (entityEvents.size() >= config.getMinEventsPerEntity()) {
                series.put(entity, DailySeries.of(entityEvents, config.getAggregation()));
            }
        }
        if (series.size() < 2) {
            log.debug("Only {} entities have at least {} events, skipping temporal analysis",
                    series.size(), config.getMinEventsPerEntity());
            return List.of();
        }

        long lastDay = series.values().stream().mapToLong(DailySeries::lastDay).max().orElseThrow();
        long firstDay = lastDay - config.getCorrelationWindowDays() + 1;
        series.replaceAll((entity, s) -> s.from(firstDay));

        List<Entity> eligible = new ArrayList<>(series.keySet());
        List<TemporalCorrelation> correlations = new ArrayList<>();
        for (int i = 0; i < eligible.size(); i++) {
            for (int j = i + 1; j < eligible.size(); j++) {
                Entity first = eligible.get(i);
                Entity second = eligible.get(j);
                correlate(first, series.get(first), second, series.get(second))
                        .ifPresent(correlations::add);
            }
        }

        log.debug("Computed {} temporal correlations across {} eligible entities", correlations.size(), eligible.size());
        return correlations;
    }

    private Optional<TemporalCorrelation> correlate(Entity first, DailySeries x, Entity second, DailySeries y) {
        DiscoveryProperties.Temporal config = properties.getTemporal();
        if (x.isEmpty() || y.isEmpty()) {
            return Optional.empty();
        }
        Optional<LagCorrelation.Result> best = LagCorrelation.bestLag(
                x, y, config.getLagWindowDays(), config.getMinLagOverlap());
        if (best.isEmpty()) {
            return Optional.empty();
        }

        LagCorrelation.Result result = best.get();
        double r = Math.abs(result.coefficient());
        double sampleSize = Math.min(1.0, (double) result.overlap() / config.getConfidenceSaturationEvents());
        double lagConsistency = lagConsistency(x, y, result.lag());

        double causality = weightedGeometricMean(
                new double[]{r, lagConsistency, sampleSize},
                new double[]{config.getCorrelationWeight(), config.getLagConsistencyWeight(), config.getSampleSizeWeight()});
        double confidence = r * (0.5 + 0.5 * sampleSize);

        long span = Math.max(x.lastDay(), y.lastDay()) - Math.min(x.firstDay(), y.firstDay()) + 1;

        return Optional.of(TemporalCorrelation.builder()
                .entity1(first)
                .entity2(second)
                .correlationCoefficient(result.coefficient())
                .optimalLagDays(result.lag())
                .causalityScore(clamp(causality))
                .confidence(clamp(confidence))
                .eventsAnalyzed(result.overlap())
                .timeWindowDays((int) span)
                .build());
    }

    /**
     * Share of sub-windows of the first series whose own best lag has the same sign as the
     * overall lag. A zero overall lag gives no direction to agree with and scores a fixed value.
     */
    private double lagConsistency(DailySeries x, DailySeries y, int globalLag) {
        DiscoveryProperties.Temporal config = properties.getTemporal();
        if (globalLag == 0) {
            return config.getZeroLagScore();
        }

        int windows = config.getCausalitySubWindows();
        long first = x.firstDay();
        long length = x.lastDay() - first + 1;
        long windowLength = Math.max(1, (length + windows - 1) / windows);

        int agreeing = 0;
        for (int w = 0; w < windows; w++) {
            long start = first + w * windowLength;
            long end = start + windowLength - 1;
            Optional<LagCorrelation.Result> local = LagCorrelation.bestLag(
                    x.between(start, end), y, config.getLagWindowDays(), config.getSubWindowMinOverlap());
            if (local.isPresent() && Integer.signum(local.get().lag()) == Integer.signum(globalLag)) {
                agreeing++;
            }
        }
        return (double) agreeing / windows;
    }

    private static double weightedGeometricMean(double[] values, double[] weights) {
        double weightSum = 0;
        double logSum = 0;
        for (int i = 0; i < values.length; i++) {
            logSum += weights[i] * Math.log(Math.max(COMPONENT_FLOOR, values[i]));
            weightSum += weights[i];
        }
        return weightSum == 0 ? 0.0 : Math.exp(logSum / weightSum);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private Relationship toRelationship(TemporalCorrelation correlation) {
        int lag = correlation.getOptimalLagDays();
        double r = correlation.getCorrelationCoefficient();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("correlation_coefficient", r);
        metadata.put("optimal_lag_days", lag);
        metadata.put("causality_score", correlation.getCausalityScore());
        metadata.put("events_analyzed", correlation.getEventsAnalyzed());
        metadata.put("time_window_days", correlation.getTimeWindowDays());

        List<String> evidence = List.of(
                String.format(Locale.ROOT, "Correlation %.2f over %d aligned days", r, correlation.getEventsAnalyzed()),
                lag == 0 ? "Series move on the same day" : String.format(Locale.ROOT, "Optimal lag %d day(s)", lag),
                String.format(Locale.ROOT, "Causality score %.2f", correlation.getCausalityScore()));

        Relationship.RelationshipBuilder builder = Relationship.builder()
                .strength(strengthOf(Math.abs(r)))
                .confidence(correlation.getConfidence())
                .evidence(evidence)
                .temporalAspect(TemporalAspect.ONGOING)
                .metadata(metadata);

        if (lag == 0) {
            return builder
                    .source(correlation.getEntity1())
                    .target(correlation.getEntity2())
                    .relationshipType(RelationshipType.CORRELATES_WITH)
                    .direction(RelationshipDirection.BIDIRECTIONAL)
                    .build();
        }

        // Positive lag: entity1 leads and entity2 follows
        Entity follower = lag > 0 ? correlation.getEntity2() : correlation.getEntity1();
        Entity leader = lag > 0 ? correlation.getEntity1() : correlation.getEntity2();
        return builder
                .source(follower)
                .target(leader)
                .relationshipType(RelationshipType.INFLUENCED_BY)
                .direction(RelationshipDirection.UNIDIRECTIONAL)
                .build();
    }

    private static RelationshipStrength strengthOf(double absoluteCorrelation) {
        if (absoluteCorrelation >= 0.8) {
            return RelationshipStrength.STRONG;
        }
        if (absoluteCorrelation >= 0.6) {
            return RelationshipStrength.MODERATE;
        }
        return RelationshipStrength.WEAK;
    }

    @Override
    public List<TemporalCluster> detectTemporalClusters(Collection<Event> events) {
        return detectTemporalClusters(events, properties.getTemporal().getClusterWindowDays());
    }

    @Override
    public List<TemporalCluster> detectTemporalClusters(Collection<Event> events, int windowDays) {
        checkArgument(windowDays > 0, "windowDays must be > 0, was %s", windowDays);
        int minSize = properties.getTemporal().getMinClusterSize();

        List<Event> sorted = events.stream()
                .filter(e -> e.getTimestamp() != null)
                .sorted(Comparator.comparing(Event::getTimestamp))
                .toList();

        List<TemporalCluster> clusters = new ArrayList<>();
        List<Event> current = new ArrayList<>();
        Duration window = Duration.ofDays(windowDays);
        for (Event event : sorted) {
            if (!current.isEmpty()
                    && Duration.between(current.get(0).getTimestamp(), event.getTimestamp()).compareTo(window) > 0) {
                addIfLargeEnough(clusters, current, minSize);
                current = new ArrayList<>();
            }
            current.add(event);
        }
        addIfLargeEnough(clusters, current, minSize);

        log.debug("Detected {} temporal clusters in {} events", clusters.size(), sorted.size());
        return clusters;
    }

    private static void addIfLargeEnough(List<TemporalCluster> clusters, List<Event> events, int minSize) {
        if (events.size() >= minSize) {
            clusters.add(new TemporalCluster(
                    events.get(0).getTimestamp(),
                    events.get(events.size() - 1).getTimestamp(),
                    List.copyOf(events)));
        }
    }
}
