package com.purchasingpower.discovery.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class Document {
    String id;
    String source;
    String text;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
