package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.configuration.WorkGraphProperties;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Browse query builder")
class BrowseQueryBuilderTest {

    private BrowseQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new BrowseQueryBuilder(new WorkGraphProperties());
    }

    @Test
    @DisplayName("Count query shares the predicate of the main query")
    void countSharesPredicate() {
        // Given
        QueryFilters filters = QueryFilters.builder().status("blocked").build();

        // When
        BrowseQuery query = builder.build(QueryType.BY_STATUS, filters);

        // Then
        assertThat(query.isPaginated()).isTrue();
        assertThat(query.getCypher()).contains("WHERE n.status = $status").contains("SKIP $offset").contains("LIMIT $limit");
        assertThat(query.getCountCypher()).contains("WHERE n.status = $status").contains("count(n) AS total");
        assertThat(query.getParameters()).containsEntry("status", "BLOCKED");
    }

    @Test
    @DisplayName("Limit and offset default to 50 and 0 and are bound as integers")
    void defaultsBoundAsIntegers() {
        BrowseQuery query = builder.build(QueryType.ALL_NODES, null);

        assertThat(query.getLimit()).isEqualTo(50);
        assertThat(query.getOffset()).isZero();
        assertThat(query.getParameters().get("limit")).isEqualTo(50L);
        assertThat(query.getParameters().get("offset")).isEqualTo(0L);
    }

    @Test
    @DisplayName("by_priority orders by composite priority and defaults the minimum to 0")
    void byPriority() {
        BrowseQuery query = builder.build(QueryType.BY_PRIORITY,
            QueryFilters.builder().limit(10).offset(0).build());

        assertThat(query.getCypher()).contains("ORDER BY n.priorityComputed DESC");
        assertThat(query.getParameters()).containsEntry("minPriority", 0.0);
    }

    @Test
    @DisplayName("by_type without node_type fails naming the filter")
    void missingRequiredFilter() {
        assertThatThrownBy(() -> builder.build(QueryType.BY_TYPE, QueryFilters.builder().build()))
            .isInstanceOf(GraphOperationException.class)
            .hasMessage("node_type filter is required for by_type query");
    }

    @Test
    @DisplayName("Unknown node type is rejected instead of falling back")
    void unknownTypeRejected() {
        assertThatThrownBy(() -> builder.build(QueryType.BY_TYPE, QueryFilters.builder().nodeType("SPIKE").build()))
            .isInstanceOf(GraphOperationException.class)
            .hasMessageContaining("Must be one of");
    }

    @Test
    @DisplayName("dependencies is a single lookup without a count query")
    void dependenciesHasNoCount() {
        BrowseQuery query = builder.build(QueryType.DEPENDENCIES, QueryFilters.builder().nodeId("node-1").build());

        assertThat(query.isPaginated()).isFalse();
        assertThat(query.getCountCypher()).isNull();
        assertThat(query.getCypher()).contains("DEPENDS_ON");
        assertThat(query.getParameters()).containsEntry("nodeId", "node-1");
    }

    @Test
    @DisplayName("Non-positive limit is a validation error")
    void nonPositiveLimit() {
        assertThatThrownBy(() -> builder.resolveLimit(0)).isInstanceOf(GraphOperationException.class);
        assertThatThrownBy(() -> builder.resolveOffset(-5)).isInstanceOf(GraphOperationException.class);
    }

    @Test
    @DisplayName("Search matches title and description case-insensitively")
    void search() {
        BrowseQuery query = builder.build(QueryType.SEARCH, QueryFilters.builder().searchTerm("  Login ").build());

        assertThat(query.getCypher()).contains("toLower($searchTerm)");
        assertThat(query.getParameters()).containsEntry("searchTerm", "Login");
    }
}
