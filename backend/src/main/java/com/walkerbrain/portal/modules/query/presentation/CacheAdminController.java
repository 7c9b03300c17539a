package com.walkerbrain.portal.modules.query.presentation;

import java.util.Map;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.auth.application.AuthService;
import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/cache")
@Tag(name = "Admin")
public class CacheAdminController {

    private static final Logger log = LoggerFactory.getLogger(CacheAdminController.class);

    private final CachedQueryExecutor executor;
    private final AuthService authService;

    public CacheAdminController(CachedQueryExecutor executor, AuthService authService) {
        this.executor = executor;
        this.authService = authService;
    }

    @PostMapping("/invalidate")
    @Operation(summary = "Drop cached reads by key prefix, or everything when no prefix is given")
    public ResponseEntity<Map<String, Object>> invalidate(
            @RequestParam(name = "prefix", required = false) String prefix,
            ViewContext context
    ) {
        authService.requireAdmin(context.principal());
        int removed = prefix == null || prefix.isBlank()
                ? executor.invalidateAll()
                : executor.invalidate(prefix.strip());
        log.info("[Cache] {} invalidated prefix='{}' removed={}", context.actorEmail(), prefix, removed);
        return ResponseEntity.ok(Map.of(
                "prefix", prefix == null ? "" : prefix.strip(),
                "removed", removed,
                "remaining", executor.cachedEntries()
        ));
    }
}
