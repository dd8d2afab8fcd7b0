package com.datasetsearch.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 响应中的一行。搜索不截断单元格，truncated_cells 恒为空。
 */
public record ResultRow(
        @JsonProperty("row_idx") int rowIdx,
        @JsonProperty("row") JsonNode row,
        @JsonProperty("truncated_cells") List<String> truncatedCells
) {

    public ResultRow(int rowIdx, JsonNode row) {
        this(rowIdx, row, List.of());
    }
}
