package com.purchasingpower.discovery.config;

import com.purchasingpower.discovery.model.RelationshipRule;
import com.purchasingpower.discovery.model.RelationshipType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tunables for every discovery strategy.
 *
 * <p>Properties are loaded from the {@code discovery} namespace in application.yml.
 * Example configuration:
 * <pre>
 * discovery:
 *   multi-hop:
 *     max-hops: 3
 *     min-path-confidence: 0.3
 *   temporal:
 *     lag-window-days: 30
 *     min-events-per-entity: 10
 *   semantic:
 *     max-text-length: 10000
 *   patterns:
 *     hub-centrality-threshold: 0.5
 *     min-community-size: 3
 * </pre>
 *
 * <p>Every field carries an in-code default, so services can also be constructed with
 * {@code new DiscoveryProperties()} outside a Spring context.
 */
@ConfigurationProperties(prefix = "discovery")
@Validated
@Data
public class DiscoveryProperties {

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Context context = new Context();

    @Valid
    private Explicit explicit = new Explicit();

    @Valid
    private MultiHop multiHop = new MultiHop();

    @Valid
    private Temporal temporal = new Temporal();

    @Valid
    private Semantic semantic = new Semantic();

    @Valid
    private Patterns patterns = new Patterns();

    /**
     * Thread pool shared by the orchestrator and batch document mining.
     */
    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 100;
        private String threadNamePrefix = "discovery-";
    }

    /**
     * Default output filter, used when a request does not bring its own.
     */
    @Data
    public static class Context {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.0;
        private Set<RelationshipType> excludeTypes = new HashSet<>();
    }

    @Data
    public static class Explicit {
        private boolean enabled = true;

        /**
         * Foreign-key rules. When empty the built-in default rule set is used.
         */
        @Valid
        private List<RelationshipRule> rules = new ArrayList<>();

        /**
         * Also derive WORKS_WITH / PRECEDES from shared team and date attributes.
         */
        private boolean inferFromAttributes = false;
    }

    @Data
    public static class MultiHop {
        private boolean enabled = true;

        /**
         * Maximum number of edges in a discovered path. Values below 2 disable the strategy.
         * Default: 3
         */
        @Min(0)
        private int maxHops = 3;

        /**
         * Paths whose confidence product falls below this are dropped.
         * Default: 0.3
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minPathConfidence = 0.3;

        /**
         * Wall-clock budget for one discovery call; the search stops early once exceeded.
         * Default: 5000
         */
        @Min(1)
        private long maxSearchMillis = 5000;
    }

    @Data
    public static class Temporal {
        private boolean enabled = true;

        /**
         * Lags from -lagWindowDays to +lagWindowDays are searched.
         * Default: 30
         */
        @Min(0)
        private int lagWindowDays = 30;

        /**
         * Entities with fewer events are not correlated.
         * Default: 10
         */
        @Min(2)
        private int minEventsPerEntity = 10;

        /**
         * Only the most recent N days of the shared range are analysed.
         * Default: 90
         */
        @Min(1)
        private int correlationWindowDays = 90;

        /**
         * Minimum aligned daily points before a lag is considered.
         * Default: 10
         */
        @Min(3)
        private int minLagOverlap = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minCorrelation = 0.5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minCausality = 0.5;

        private Aggregation aggregation = Aggregation.SUM;

        /**
         * Number of sub-windows checked for lag sign consistency.
         */
        @Min(1)
        private int causalitySubWindows = 3;

        /**
         * Aligned points required inside one sub-window.
         */
        @Min(3)
        private int subWindowMinOverlap = 4;

        /**
         * Lag consistency credited when the best lag is zero.
         */
        private double zeroLagScore = 0.3;

        /**
         * Sample size at which the sample component saturates at 1.
         */
        @Min(1)
        private int confidenceSaturationEvents = 50;

        private double correlationWeight = 0.5;
        private double lagConsistencyWeight = 0.3;
        private double sampleSizeWeight = 0.2;

        /**
         * Window used by temporal cluster detection.
         */
        @Min(1)
        private int clusterWindowDays = 7;

        @Min(2)
        private int minClusterSize = 3;

        public enum Aggregation {
            SUM, MEAN, COUNT
        }
    }

    @Data
    public static class Semantic {
        private boolean enabled = true;

        @Min(1)
        private int maxTextLength = 10000;

        /**
         * Maximum characters between two mentions for a phrase pattern to apply.
         */
        @Min(1)
        private int maxMentionGap = 80;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double baseConfidence = 0.8;

        /**
         * Multiplier applied when the sentence hedges ("might", "appears"...).
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double hedgePenalty = 0.6;

        /**
         * Characters of surrounding text returned as relationship context.
         */
        @Min(0)
        private int contextWindow = 50;

        @Min(1)
        private int batchSize = 10;
    }

    @Data
    public static class Patterns {
        private boolean enabled = true;

        @Min(1)
        private int hubMinConnections = 3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double hubCentralityThreshold = 0.5;

        /**
         * Nodes at or above this centrality percentile also qualify as hubs.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double hubPercentile = 0.9;

        @Min(2)
        private int minCommunitySize = 3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minTriangleStrength = 0.5;

        @Min(0)
        private int maxTriangles = 100;

        @Min(2)
        private int minSpokes = 4;

        @Min(2)
        private int minChainLength = 3;

        @Min(2)
        private int maxChainLength = 10;
    }
}
