package com.walkerbrain.portal.modules.query.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.modules.query.domain.PageCursor;

import org.junit.jupiter.api.Test;

class PaginationServiceTest {

    private final PaginationService paginationService = new PaginationService(mock(CachedQueryExecutor.class));

    @Test
    void offsetPastTheEndIsPulledBackToLastPage() {
        PageCursor cursor = paginationService.page(200, 20, 95);

        assertThat(cursor.pageIndex()).isEqualTo(4);
        assertThat(cursor.totalPages()).isEqualTo(5);
        assertThat(cursor.offset()).isEqualTo(80);
        assertThat(cursor.hasPrevious()).isTrue();
        assertThat(cursor.hasNext()).isFalse();
    }

    @Test
    void emptyResultSitsOnFirstPage() {
        PageCursor cursor = paginationService.forPageIndex(3, 20, 0);

        assertThat(cursor.pageIndex()).isZero();
        assertThat(cursor.totalPages()).isZero();
        assertThat(cursor.offset()).isZero();
        assertThat(cursor.hasPrevious()).isFalse();
        assertThat(cursor.hasNext()).isFalse();
    }

    @Test
    void middlePageHasBothNeighbours() {
        PageCursor cursor = paginationService.forPageIndex(1, 20, 95);

        assertThat(cursor.offset()).isEqualTo(20);
        assertThat(cursor.hasPrevious()).isTrue();
        assertThat(cursor.hasNext()).isTrue();
    }

    @Test
    void negativeOffsetIsTreatedAsZero() {
        assertThat(paginationService.page(-40, 20, 95).pageIndex()).isZero();
    }

    @Test
    void exactMultipleDoesNotCreateEmptyTrailingPage() {
        PageCursor cursor = paginationService.forPageIndex(9, 20, 100);

        assertThat(cursor.totalPages()).isEqualTo(5);
        assertThat(cursor.pageIndex()).isEqualTo(4);
    }

    @Test
    void nonPositivePageSizeIsRejected() {
        ProblemException ex = assertThrows(ProblemException.class, () -> paginationService.page(0, 0, 10));

        assertThat(ex.getCode()).isEqualTo("INVALID_PAGE_SIZE");
    }
}
