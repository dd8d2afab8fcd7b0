package com.datasetsearch.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 列类型描述，按 split 解析一次后同时用于文本抽取与响应序列化。
 */
public sealed interface FeatureType permits FeatureType.ValueType, FeatureType.ClassLabelType,
        FeatureType.SequenceType, FeatureType.LargeListType, FeatureType.StructType,
        FeatureType.TranslationType, FeatureType.ArrayType, FeatureType.MediaType {

    /** 可索引的字符串 dtype */
    Set<String> STRING_DTYPES = Set.of("string", "large_string");

    /**
     * 该类型（含嵌套子类型）是否包含至少一个可索引的字符串叶子。
     */
    boolean containsText();

    record ValueType(String dtype) implements FeatureType {
        public boolean isString() {
            return STRING_DTYPES.contains(dtype);
        }

        @Override
        public boolean containsText() {
            return isString();
        }
    }

    record ClassLabelType(List<String> names) implements FeatureType {
        @Override
        public boolean containsText() {
            return false;
        }
    }

    /**
     * 定长或变长列表；length 为 -1 表示不限长度。
     */
    record SequenceType(FeatureType feature, int length) implements FeatureType {
        @Override
        public boolean containsText() {
            return feature.containsText();
        }
    }

    record LargeListType(FeatureType feature) implements FeatureType {
        @Override
        public boolean containsText() {
            return feature.containsText();
        }
    }

    /**
     * 结构体，字段顺序即 schema 声明顺序。
     */
    record StructType(Map<String, FeatureType> fields) implements FeatureType {
        public StructType {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public boolean containsText() {
            return fields.values().stream().anyMatch(FeatureType::containsText);
        }
    }

    /**
     * 多语言翻译，单元格内每个语言对应一段字符串。
     */
    record TranslationType(List<String> languages, boolean variableLanguages) implements FeatureType {
        @Override
        public boolean containsText() {
            return true;
        }
    }

    record ArrayType(String kind, List<Integer> shape, String dtype) implements FeatureType {
        @Override
        public boolean containsText() {
            return false;
        }
    }

    /** Image / Audio / Video / Pdf */
    record MediaType(String kind) implements FeatureType {
        @Override
        public boolean containsText() {
            return false;
        }
    }
}
