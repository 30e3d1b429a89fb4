package com.purchasingpower.workgraph.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity reported by the health endpoint ({@code app.server}).
 */
@Data
@ConfigurationProperties(prefix = "app.server")
public class ServerInfoProperties {

    private String name = "work-graph-engine";

    private String version = "1.0.0";
}
