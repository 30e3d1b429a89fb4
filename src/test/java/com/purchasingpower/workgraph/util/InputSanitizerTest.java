package com.purchasingpower.workgraph.util;

import com.purchasingpower.workgraph.core.WorkItemStatus;
import com.purchasingpower.workgraph.core.WorkItemType;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Input sanitizer")
class InputSanitizerTest {

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        @DisplayName("Script blocks and control characters are removed")
        void stripsMarkup() {
            String result = InputSanitizer.sanitizeString("Fix\u0000 <script>alert(1)</script>login", 500);

            assertThat(result).doesNotContain("<script").doesNotContain("\u0000").contains("login");
        }

        @Test
        @DisplayName("Long input is truncated with a marker")
        void truncates() {
            String result = InputSanitizer.sanitizeString("a".repeat(600), 500);

            assertThat(result).hasSize(500 + InputSanitizer.TRUNCATION_MARKER.length())
                .endsWith(InputSanitizer.TRUNCATION_MARKER);
        }

        @Test
        @DisplayName("Null becomes empty")
        void nullIsEmpty() {
            assertThat(InputSanitizer.sanitizeString(null, 10)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Plain identifiers pass unchanged")
        void plainId() {
            assertThat(InputSanitizer.sanitizeNodeId("node_1718_a1b2.c-3")).isEqualTo("node_1718_a1b2.c-3");
        }

        @ParameterizedTest
        @ValueSource(strings = {"x' OR 1=1", "a; MATCH (n) DETACH DELETE n", "id//comment", "id/*x*/", "$param"})
        @DisplayName("Injection-looking identifiers are rejected")
        void rejectsInjection(String id) {
            assertThatThrownBy(() -> InputSanitizer.sanitizeNodeId(id))
                .isInstanceOf(GraphOperationException.class);
        }

        @Test
        @DisplayName("Identifiers must start with a letter or digit")
        void mustStartAlphanumeric() {
            assertThatThrownBy(() -> InputSanitizer.sanitizeNodeId("_hidden"))
                .hasMessageContaining("cannot start with special characters");
        }

        @Test
        @DisplayName("Identifiers over 100 characters are rejected")
        void tooLong() {
            assertThatThrownBy(() -> InputSanitizer.sanitizeNodeId("a".repeat(101)))
                .hasMessageContaining("too long");
        }

        @Test
        @DisplayName("Missing identifier is reported with its label")
        void missing() {
            assertThatThrownBy(() -> InputSanitizer.sanitizeId(" ", "Contributor ID"))
                .hasMessage("Contributor ID is required");
        }
    }

    @Nested
    @DisplayName("Enums and priorities")
    class EnumsAndPriorities {

        @Test
        @DisplayName("Absent type falls back, unknown type is rejected")
        void nodeType() {
            assertThat(InputSanitizer.sanitizeNodeType(null, WorkItemType.TASK)).isEqualTo(WorkItemType.TASK);
            assertThat(InputSanitizer.sanitizeNodeType("bug", WorkItemType.TASK)).isEqualTo(WorkItemType.BUG);
            assertThatThrownBy(() -> InputSanitizer.sanitizeNodeType("CHORE", WorkItemType.TASK))
                .hasMessageStartingWith("Invalid node type. Must be one of:");
        }

        @Test
        @DisplayName("Status without fallback is required")
        void statusRequired() {
            assertThat(InputSanitizer.sanitizeNodeStatus("in_progress", null)).isEqualTo(WorkItemStatus.IN_PROGRESS);
            assertThatThrownBy(() -> InputSanitizer.sanitizeNodeStatus(null, null))
                .hasMessage("node status is required");
        }

        @Test
        @DisplayName("Priorities outside [0,1] are rejected, not clamped")
        void priorityRange() {
            assertThat(InputSanitizer.sanitizePriority(0.75, "priority_executive")).isEqualTo(0.75);
            assertThat(InputSanitizer.sanitizePriority(null, "priority_executive")).isNull();
            assertThatThrownBy(() -> InputSanitizer.sanitizePriority(1.2, "priority_executive"))
                .hasMessageContaining("between 0 and 1");
            assertThatThrownBy(() -> InputSanitizer.sanitizePriority(Double.NaN, "priority_executive"))
                .isInstanceOf(GraphOperationException.class);
        }
    }

    @Nested
    @DisplayName("Metadata and limits")
    class MetadataAndLimits {

        @Test
        @DisplayName("Metadata keeps at most 50 top-level keys")
        void topLevelKeyLimit() {
            Map<String, Object> metadata = new HashMap<>();
            for (int i = 0; i < 60; i++) {
                metadata.put("key" + i, i);
            }

            assertThat(InputSanitizer.sanitizeMetadata(metadata)).hasSize(50);
        }

        @Test
        @DisplayName("Arrays are cut to 1000 items plus a truncation marker")
        void arrayLimit() {
            List<Integer> items = new ArrayList<>();
            for (int i = 0; i < 1500; i++) {
                items.add(i);
            }

            Map<String, Object> sanitized = InputSanitizer.sanitizeMetadata(Map.of("items", items));

            List<?> kept = (List<?>) sanitized.get("items");
            assertThat(kept).hasSize(1001);
            assertThat(kept.get(1000)).isEqualTo("[ARRAY_TRUNCATED]");
        }

        @Test
        @DisplayName("Non-object metadata becomes an empty map")
        void nonObject() {
            assertThat(InputSanitizer.sanitizeMetadata("just text")).isEmpty();
        }

        @Test
        @DisplayName("Bulk limit reports maximum and actual count")
        void bulkLimit() {
            InputSanitizer.validateBulkOperation(100, 100);

            assertThatThrownBy(() -> InputSanitizer.validateBulkOperation(101, 100))
                .hasMessage("Bulk operation limit exceeded. Maximum 100 items allowed, got 101");
        }

        @Test
        @DisplayName("Oversized payloads are rejected")
        void payloadLimit() {
            Map<String, Object> payload = Map.of("blob", "x".repeat(2 * 1024 * 1024));

            assertThatThrownBy(() -> InputSanitizer.validateMemoryUsage(payload, 1))
                .hasMessageContaining("Payload too large");
        }
    }
}
