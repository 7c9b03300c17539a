package com.walkerbrain.portal.modules.transcripts.presentation.dto;

import java.util.List;

import com.walkerbrain.portal.modules.transcripts.domain.ColumnGroup;

public record ColumnGroupResponse(String name, String label, List<String> columns, boolean isDefault) {

    public static ColumnGroupResponse from(ColumnGroup group) {
        return new ColumnGroupResponse(group.name(), group.getLabel(), group.getColumns(),
                group == ColumnGroup.CORE);
    }
}
