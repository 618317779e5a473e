package com.purchasingpower.discovery.service;

import com.purchasingpower.discovery.model.DiscoveryRequest;

/**
 * Runs every enabled discovery strategy over one snapshot and merges the results.
 */
public interface RelationshipDiscoveryService {

    DiscoveryResult discover(DiscoveryRequest request);
}
