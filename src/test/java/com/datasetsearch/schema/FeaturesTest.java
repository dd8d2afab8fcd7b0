package com.datasetsearch.schema;

import com.datasetsearch.error.ErrorCode;
import com.datasetsearch.error.UnsupportedDatasetException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeaturesTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("解析时保留列的声明顺序与类型")
    void testParseKeepsOrder() throws Exception {
        Features features = Features.parse(json("""
            {
              "text": {"dtype": "string", "_type": "Value"},
              "label": {"names": ["neg", "pos"], "_type": "ClassLabel"},
              "score": {"dtype": "float32", "_type": "Value"},
              "tags": {"feature": {"dtype": "string", "_type": "Value"}, "_type": "Sequence"}
            }
            """));

        assertEquals(4, features.size());
        assertEquals(List.of("text", "label", "score", "tags"),
            features.columns().stream().map(Feature::name).toList());
        assertInstanceOf(FeatureType.ValueType.class, features.columns().get(0).type());
        assertInstanceOf(FeatureType.ClassLabelType.class, features.columns().get(1).type());
        FeatureType.SequenceType tags = assertInstanceOf(FeatureType.SequenceType.class, features.columns().get(3).type());
        assertEquals(-1, tags.length());
    }

    @Test
    @DisplayName("只有字符串叶子（含嵌套）的列可索引")
    void testIndexableColumns() throws Exception {
        Features features = Features.parse(json("""
            {
              "id": {"dtype": "int64", "_type": "Value"},
              "title": {"dtype": "large_string", "_type": "Value"},
              "meta": {"author": {"dtype": "string", "_type": "Value"}, "year": {"dtype": "int32", "_type": "Value"}},
              "legacy": [{"dtype": "string", "_type": "Value"}],
              "image": {"_type": "Image"},
              "matrix": {"shape": [2, 2], "dtype": "float32", "_type": "Array2D"},
              "tr": {"languages": ["en", "fr"], "_type": "Translation"}
            }
            """));

        assertEquals(List.of("title", "meta", "legacy", "tr"), features.indexableColumns());
        assertTrue(features.hasIndexableColumns());
        assertInstanceOf(FeatureType.StructType.class, features.find("meta").orElseThrow().type());
        assertInstanceOf(FeatureType.ArrayType.class, features.find("matrix").orElseThrow().type());
    }

    @Test
    @DisplayName("没有字符串列时不可索引")
    void testNoIndexableColumns() throws Exception {
        Features features = Features.parse(json("""
            {"x": {"dtype": "int64", "_type": "Value"}, "audio": {"_type": "Audio"}}
            """));

        assertFalse(features.hasIndexableColumns());
        assertTrue(features.indexableColumns().isEmpty());
    }

    @Test
    @DisplayName("未知类型视为不支持的数据集")
    void testUnknownTypeRejected() throws Exception {
        JsonNode descriptor = json("""
            {"blob": {"_type": "Hologram"}}
            """);

        UnsupportedDatasetException exception = assertThrows(UnsupportedDatasetException.class,
            () -> Features.parse(descriptor));
        assertEquals(ErrorCode.UNSUPPORTED_DATASET, exception.getErrorCode());
        assertFalse(exception.isRetryable());
    }

    @Test
    @DisplayName("features 列表带序号并保留原始类型描述")
    void testToFeaturesList() throws Exception {
        Features features = Features.parse(json("""
            {"a": {"dtype": "string", "_type": "Value"}, "b": {"dtype": "bool", "_type": "Value"}}
            """));

        List<FeatureItem> items = features.toFeaturesList();

        assertEquals(2, items.size());
        assertEquals(0, items.get(0).featureIdx());
        assertEquals("a", items.get(0).name());
        assertEquals("string", items.get(0).type().get("dtype").asText());
        assertEquals(1, items.get(1).featureIdx());

        String serialized = MAPPER.writeValueAsString(items.get(1));
        assertTrue(serialized.contains("\"feature_idx\":1"));
    }

    @Test
    @DisplayName("写出后再读回得到相同的列")
    void testWriteAndRead() throws Exception {
        Features original = Features.parse(json("""
            {"q": {"dtype": "string", "_type": "Value"}, "n": {"dtype": "int8", "_type": "Value"}}
            """));
        Path file = tempDir.resolve("features.json");

        original.write(file);
        Features reloaded = Features.read(file);

        assertEquals(original.columns(), reloaded.columns());
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }
}
