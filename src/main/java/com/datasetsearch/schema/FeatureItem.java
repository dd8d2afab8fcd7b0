package com.datasetsearch.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 响应中的列描述。JSON 对象本身无序，所以列以有序数组返回。
 */
public record FeatureItem(
        @JsonProperty("feature_idx") int featureIdx,
        @JsonProperty("name") String name,
        @JsonProperty("type") JsonNode type
) {
}
