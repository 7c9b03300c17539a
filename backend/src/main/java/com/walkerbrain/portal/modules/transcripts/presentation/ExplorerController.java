package com.walkerbrain.portal.modules.transcripts.presentation;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.walkerbrain.portal.modules.query.presentation.CacheHeaders;
import com.walkerbrain.portal.modules.transcripts.application.ExplorerService;
import com.walkerbrain.portal.modules.transcripts.domain.CallFilterCriteria;
import com.walkerbrain.portal.modules.transcripts.domain.ColumnGroup;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ColumnGroupResponse;
import com.walkerbrain.portal.modules.transcripts.presentation.dto.ExplorerPageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Raw call data by column group. Without a {@code group} parameter the core group is shown; an empty one
 * is rejected.
 */
@RestController
@Tag(name = "Explorer")
public class ExplorerController {

    private final ExplorerService explorerService;

    public ExplorerController(ExplorerService explorerService) {
        this.explorerService = explorerService;
    }

    @GetMapping("/explorer")
    @Operation(summary = "Analysed calls projected through column groups, newest first")
    public ResponseEntity<ExplorerPageResponse> explore(
            @RequestParam(name = "group", required = false) List<String> groups,
            @RequestParam(name = "caseType", required = false) List<String> caseTypes,
            @RequestParam(name = "language", required = false) List<String> languages,
            @RequestParam(name = "minQuality", required = false) Integer minQuality,
            @RequestParam(name = "maxQuality", required = false) Integer maxQuality,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "page", defaultValue = "0") int page
    ) {
        CallFilterCriteria criteria = new CallFilterCriteria(null, caseTypes, null, languages, minQuality,
                maxQuality, startDate, endDate, false, false, false);
        ExplorerPageResponse response = explorerService.explore(selectedGroups(groups), criteria, page);
        return CacheHeaders.ok(response, response.cacheStatus());
    }

    @GetMapping("/explorer/column-groups")
    @Operation(summary = "Column groups the explorer can show")
    public List<ColumnGroupResponse> columnGroups() {
        return Arrays.stream(ColumnGroup.values()).map(ColumnGroupResponse::from).toList();
    }

    static Set<ColumnGroup> selectedGroups(List<String> groups) {
        if (groups == null) {
            return EnumSet.of(ColumnGroup.CORE);
        }
        Set<ColumnGroup> selected = EnumSet.noneOf(ColumnGroup.class);
        for (String group : groups) {
            if (group != null && !group.isBlank()) {
                selected.add(ColumnGroup.from(group));
            }
        }
        return selected;
    }
}
