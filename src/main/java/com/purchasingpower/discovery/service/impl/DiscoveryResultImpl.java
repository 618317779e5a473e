package com.purchasingpower.discovery.service.impl;

import com.purchasingpower.discovery.model.GraphPattern;
import com.purchasingpower.discovery.model.Relationship;
import com.purchasingpower.discovery.service.DiscoveryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of DiscoveryResult.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResultImpl implements DiscoveryResult {

    @Builder.Default
    private List<Relationship> relationships = new ArrayList<>();

    @Builder.Default
    private List<GraphPattern> patterns = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> strategyCounts = new LinkedHashMap<>();

    private int skippedEntities;
    private long durationMs;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static DiscoveryResultImpl empty(long durationMs) {
        return DiscoveryResultImpl.builder()
                .durationMs(durationMs)
                .build();
    }
}
