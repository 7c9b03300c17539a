package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.Map;

import com.walkerbrain.portal.modules.query.domain.PagedResult;

public record AngleBankResponse(PagedResult<AngleResponse> angles, Summary summary) {

    public record Summary(long total, long pendingReview, long approved, Map<String, Long> byContentType) {
    }
}
