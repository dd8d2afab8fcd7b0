package com.datasetsearch.query;

import com.datasetsearch.schema.FeatureItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 搜索响应。rows 按 row_idx 升序，num_rows_total 为分页前的命中总数。
 */
@JsonPropertyOrder({"features", "rows", "num_rows_total", "num_rows_per_page", "partial"})
public record SearchResponse(
        @JsonProperty("features") List<FeatureItem> features,
        @JsonProperty("rows") List<ResultRow> rows,
        @JsonProperty("num_rows_total") int numRowsTotal,
        @JsonProperty("num_rows_per_page") int numRowsPerPage,
        @JsonProperty("partial") boolean partial
) {
}
