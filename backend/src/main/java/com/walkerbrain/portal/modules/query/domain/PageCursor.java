package com.walkerbrain.portal.modules.query.domain;

/**
 * Navigation state for one page. {@code pageIndex} is zero-based and never negative; {@code offset} is
 * always {@code pageIndex * pageSize}.
 */
public record PageCursor(
        int pageIndex,
        int pageSize,
        int totalPages,
        long totalCount,
        boolean hasPrevious,
        boolean hasNext,
        long offset
) {
}
