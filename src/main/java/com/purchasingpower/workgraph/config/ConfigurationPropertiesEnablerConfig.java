package com.purchasingpower.workgraph.config;

import com.purchasingpower.workgraph.configuration.ServerInfoProperties;
import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link WorkGraphProperties} - engine limits and priority weights ({@code app.graph})
 *   <li>{@link ServerInfoProperties} - name and version reported by /health ({@code app.server})
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    WorkGraphProperties.class,
    ServerInfoProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
