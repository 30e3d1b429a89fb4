package com.purchasingpower.workgraph.query;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page metadata for a paginated listing.
 *
 * <p>{@code current_page = floor(offset/limit) + 1},
 * {@code total_pages = ceil(total/limit)}.
 */
@Getter
public final class PageInfo {

    private final long totalCount;
    private final int limit;
    private final int offset;
    private final long currentPage;
    private final long totalPages;
    private final boolean hasNextPage;
    private final boolean hasPreviousPage;

    private PageInfo(long totalCount, int limit, int offset) {
        this.totalCount = totalCount;
        this.limit = limit;
        this.offset = offset;
        this.currentPage = offset / limit + 1;
        this.totalPages = (totalCount + limit - 1) / limit;
        this.hasNextPage = currentPage < totalPages;
        this.hasPreviousPage = currentPage > 1;
    }

    /**
     * @throws GraphOperationException if {@code limit <= 0} or {@code offset < 0}
     */
    public static PageInfo of(long totalCount, int limit, int offset) {
        if (limit <= 0) {
            throw GraphOperationException.validation("limit must be greater than 0, got " + limit);
        }
        if (offset < 0) {
            throw GraphOperationException.validation("offset must not be negative, got " + offset);
        }
        return new PageInfo(Math.max(0, totalCount), limit, offset);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("current_page", currentPage);
        map.put("total_pages", totalPages);
        map.put("total_count", totalCount);
        map.put("has_next_page", hasNextPage);
        map.put("has_previous_page", hasPreviousPage);
        map.put("limit", limit);
        map.put("offset", offset);
        return map;
    }
}
