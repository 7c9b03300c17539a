package com.walkerbrain.portal.modules.transcripts.presentation;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.SystemHealthService;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.AdminHealthResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.SystemStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "System")
public class SystemHealthController {

    private final SystemHealthService systemHealthService;

    public SystemHealthController(SystemHealthService systemHealthService) {
        this.systemHealthService = systemHealthService;
    }

    @GetMapping("/system/status")
    @Operation(summary = "Pipeline state and seven-day throughput")
    public ResponseEntity<SystemStatusResponse> getStatus() {
        SystemStatusResponse response = systemHealthService.status();
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/admin/system/health")
    @Operation(summary = "Budget, cost, drift and prompt detail for administrators")
    public ResponseEntity<AdminHealthResponse> getAdminHealth(ViewContext context) {
        return ResponseEntity.ok(systemHealthService.adminHealth(context));
    }
}
