package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.core.ErrorKind;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Page metadata")
class PageInfoTest {

    @Test
    @DisplayName("First page of 23 items by 10 has three pages and a next page")
    void firstPageOfTwentyThree() {
        // When
        PageInfo page = PageInfo.of(23, 10, 0);

        // Then
        assertThat(page.getCurrentPage()).isEqualTo(1);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.isHasNextPage()).isTrue();
        assertThat(page.isHasPreviousPage()).isFalse();
    }

    @Test
    @DisplayName("Last page has no next page")
    void lastPage() {
        PageInfo page = PageInfo.of(23, 10, 20);

        assertThat(page.getCurrentPage()).isEqualTo(3);
        assertThat(page.isHasNextPage()).isFalse();
        assertThat(page.isHasPreviousPage()).isTrue();
    }

    @Test
    @DisplayName("Empty result has zero pages")
    void emptyResult() {
        PageInfo page = PageInfo.of(0, 50, 0);

        assertThat(page.getTotalPages()).isZero();
        assertThat(page.isHasNextPage()).isFalse();
        assertThat(page.toMap())
            .containsEntry("total_count", 0L)
            .containsEntry("limit", 50)
            .containsEntry("offset", 0);
    }

    @ParameterizedTest(name = "total={0}, limit={1}, offset={2}")
    @CsvSource({
        "1, 1, 0",
        "10, 3, 9",
        "100, 7, 49",
        "5, 10, 0",
        "99, 33, 66"
    })
    @DisplayName("Current page stays within the page range and next page matches it")
    void currentPageWithinRange(long total, int limit, int offset) {
        PageInfo page = PageInfo.of(total, limit, offset);

        assertThat(page.getCurrentPage()).isBetween(1L, page.getTotalPages());
        assertThat(page.isHasNextPage()).isEqualTo(page.getCurrentPage() < page.getTotalPages());
    }

    @Test
    @DisplayName("Zero limit is rejected before any division")
    void zeroLimitRejected() {
        assertThatThrownBy(() -> PageInfo.of(10, 0, 0))
            .isInstanceOf(GraphOperationException.class)
            .extracting(e -> ((GraphOperationException) e).getKind())
            .isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    @DisplayName("Negative offset is rejected")
    void negativeOffsetRejected() {
        assertThatThrownBy(() -> PageInfo.of(10, 5, -1))
            .isInstanceOf(GraphOperationException.class)
            .hasMessageContaining("offset");
    }
}
