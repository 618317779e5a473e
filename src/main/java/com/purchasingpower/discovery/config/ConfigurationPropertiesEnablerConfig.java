package com.purchasingpower.discovery.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of the engine.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link DiscoveryProperties} - thresholds and toggles for every discovery strategy
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    DiscoveryProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
    // Binding only; beans live in the configuration package.
}
