package com.purchasingpower.workgraph.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and weights applied by the graph engine.
 *
 * <p>Properties are loaded from the {@code app.graph} namespace in application.yml:
 * <pre>
 * app:
 *   graph:
 *     max-bulk-operations: 100
 *     max-payload-mb: 10
 *     executive-weight: 0.4
 * </pre>
 *
 * <p>The three priority weights are expected to sum to 1.0 so that the
 * composite priority stays in [0,1].
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.graph")
public class WorkGraphProperties {

    /**
     * Maximum operations accepted by a single bulk request.
     */
    @Min(1)
    private int maxBulkOperations = 100;

    /**
     * Maximum serialized size of a mutation payload, in megabytes.
     */
    @Min(1)
    private int maxPayloadMb = 10;

    /**
     * Maximum contributors linked on create or update.
     */
    @Min(0)
    private int maxContributors = 50;

    /**
     * Page size used when a request does not name one.
     */
    @Min(1)
    private int defaultLimit = 50;

    @Min(1)
    private int maxTitleLength = 500;

    @Min(1)
    private int maxDescriptionLength = 2000;

    @Min(1)
    private int defaultRelationshipLimit = 20;

    @Min(1)
    private int maxRelationshipLimit = 100;

    /**
     * Upper bound for variable-length path searches.
     */
    @Min(1)
    private int maxPathDepth = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double executiveWeight = 0.4;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double individualWeight = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double communityWeight = 0.3;
}
