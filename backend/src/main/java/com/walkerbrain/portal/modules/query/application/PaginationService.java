package com.walkerbrain.portal.modules.query.application;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.modules.query.domain.PageCursor;
import com.walkerbrain.portal.modules.query.domain.QueryKey;
import com.walkerbrain.portal.modules.query.domain.QueryResult;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Page arithmetic plus the exact count it relies on. A request past the last page is pulled back to the
 * last page; an empty result always sits on page 0.
 */
@Service
public class PaginationService {

    private final CachedQueryExecutor executor;

    public PaginationService(CachedQueryExecutor executor) {
        this.executor = executor;
    }

    public QueryResult<Long> count(QueryKey key) {
        return executor.count(key.forCount());
    }

    public PageCursor page(long offset, int limit, long total) {
        requirePositive(limit);
        long safeOffset = Math.max(0, offset);
        return forPageIndex((int) Math.min(Integer.MAX_VALUE, safeOffset / limit), limit, total);
    }

    public PageCursor forPageIndex(int pageIndex, int limit, long total) {
        requirePositive(limit);
        long safeTotal = Math.max(0, total);
        int totalPages = (int) ((safeTotal + limit - 1) / limit);
        int index = safeTotal == 0 ? 0 : Math.min(Math.max(0, pageIndex), totalPages - 1);
        return new PageCursor(
                index,
                limit,
                totalPages,
                safeTotal,
                index > 0,
                index < totalPages - 1,
                (long) index * limit
        );
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PAGE_SIZE", "Page size must be positive.");
        }
    }
}
