package com.walkerbrain.portal.modules.query.domain;

import java.util.List;

public record PagedResult<T>(List<T> items, PageCursor page, CacheStatus cacheStatus) {
}
