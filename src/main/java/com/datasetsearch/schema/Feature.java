package com.datasetsearch.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * schema 中的一列：序号、列名、解析后的类型以及原始类型描述。
 */
public record Feature(int index, String name, FeatureType type, JsonNode descriptor) {
}
