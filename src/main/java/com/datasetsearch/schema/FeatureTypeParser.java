package com.datasetsearch.schema;

import com.datasetsearch.error.UnsupportedDatasetException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 将 datasets 风格的 features JSON 描述解析为 {@link FeatureType}。
 */
public final class FeatureTypeParser {
    private static final Set<String> ARRAY_KINDS = Set.of("Array2D", "Array3D", "Array4D", "Array5D");
    private static final Set<String> MEDIA_KINDS = Set.of("Image", "Audio", "Video", "Pdf");

    private FeatureTypeParser() {
    }

    /**
     * 解析单个类型描述。
     *
     * @param descriptor 类型 JSON
     * @return 解析结果
     * @throws UnsupportedDatasetException 类型无法识别时抛出
     */
    public static FeatureType parse(JsonNode descriptor) {
        if (descriptor == null || descriptor.isNull() || descriptor.isMissingNode()) {
            throw new UnsupportedDatasetException("特征类型描述为空");
        }
        if (descriptor.isArray()) {
            // 旧格式：[feature] 表示变长列表
            if (descriptor.size() != 1) {
                throw new UnsupportedDatasetException("列表类型描述必须只有一个元素: " + descriptor);
            }
            return new FeatureType.SequenceType(parse(descriptor.get(0)), -1);
        }
        if (!descriptor.isObject()) {
            throw new UnsupportedDatasetException("无法识别的特征类型描述: " + descriptor);
        }
        JsonNode typeNode = descriptor.get("_type");
        if (typeNode == null) {
            return parseStruct(descriptor);
        }

        String kind = typeNode.asText();
        if ("Value".equals(kind)) {
            return new FeatureType.ValueType(requireText(descriptor, "dtype"));
        }
        if ("ClassLabel".equals(kind)) {
            return new FeatureType.ClassLabelType(readStrings(descriptor.get("names")));
        }
        if ("Sequence".equals(kind) || "List".equals(kind)) {
            JsonNode lengthNode = descriptor.get("length");
            int length = lengthNode == null || lengthNode.isNull() ? -1 : lengthNode.asInt(-1);
            return new FeatureType.SequenceType(parse(requireNode(descriptor, "feature")), length);
        }
        if ("LargeList".equals(kind)) {
            return new FeatureType.LargeListType(parse(requireNode(descriptor, "feature")));
        }
        if ("Translation".equals(kind)) {
            return new FeatureType.TranslationType(readStrings(descriptor.get("languages")), false);
        }
        if ("TranslationVariableLanguages".equals(kind)) {
            return new FeatureType.TranslationType(readStrings(descriptor.get("languages")), true);
        }
        if (ARRAY_KINDS.contains(kind)) {
            List<Integer> shape = new ArrayList<>();
            JsonNode shapeNode = descriptor.get("shape");
            if (shapeNode != null && shapeNode.isArray()) {
                shapeNode.forEach(dimension -> shape.add(dimension.isNull() ? -1 : dimension.asInt()));
            }
            return new FeatureType.ArrayType(kind, List.copyOf(shape), requireText(descriptor, "dtype"));
        }
        if (MEDIA_KINDS.contains(kind)) {
            return new FeatureType.MediaType(kind);
        }
        throw new UnsupportedDatasetException("无法识别的特征类型: " + kind);
    }

    private static FeatureType.StructType parseStruct(JsonNode descriptor) {
        Map<String, FeatureType> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = descriptor.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.put(field.getKey(), parse(field.getValue()));
        }
        return new FeatureType.StructType(fields);
    }

    private static JsonNode requireNode(JsonNode descriptor, String fieldName) {
        JsonNode node = descriptor.get(fieldName);
        if (node == null || node.isNull()) {
            throw new UnsupportedDatasetException("特征类型缺少字段 " + fieldName + ": " + descriptor);
        }
        return node;
    }

    private static String requireText(JsonNode descriptor, String fieldName) {
        return requireNode(descriptor, fieldName).asText();
    }

    private static List<String> readStrings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> values.add(element.asText()));
        return List.copyOf(values);
    }
}
