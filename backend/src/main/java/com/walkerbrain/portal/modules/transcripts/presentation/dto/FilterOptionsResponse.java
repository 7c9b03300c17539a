package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;

import com.walkerbrain.portal.modules.query.domain.CacheStatus;

public record FilterOptionsResponse(
        List<String> caseTypes,
        List<String> emotionalTones,
        List<String> outcomes,
        List<String> languages,
        CacheStatus cacheStatus
) {
}
