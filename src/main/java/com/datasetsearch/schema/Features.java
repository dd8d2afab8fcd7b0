package com.datasetsearch.schema;

import com.datasetsearch.error.UnsupportedDatasetException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一个 split 的有序列 schema。
 */
public final class Features {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final List<Feature> columns;
    private final JsonNode source;

    private Features(List<Feature> columns, JsonNode source) {
        this.columns = List.copyOf(columns);
        this.source = source;
    }

    /**
     * 从 features JSON 对象解析 schema，保留列的声明顺序。
     */
    public static Features parse(JsonNode featuresNode) {
        if (featuresNode == null || !featuresNode.isObject()) {
            throw new UnsupportedDatasetException("features 必须是 JSON 对象");
        }
        List<Feature> columns = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = featuresNode.fields();
        int index = 0;
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            FeatureType type = FeatureTypeParser.parse(entry.getValue());
            columns.add(new Feature(index++, entry.getKey(), type, entry.getValue().deepCopy()));
        }
        return new Features(columns, featuresNode.deepCopy());
    }

    /**
     * 读取 features.json 文件。
     *
     * @param file features 文件
     * @return 解析后的 schema
     * @throws IOException 读取或 JSON 解析失败时抛出
     */
    public static Features read(Path file) throws IOException {
        JsonNode featuresNode;
        try {
            featuresNode = OBJECT_MAPPER.readTree(Files.readAllBytes(file));
        } catch (IOException exception) {
            throw new IOException("读取 features 失败: " + file, exception);
        }
        return parse(featuresNode);
    }

    /**
     * 原样写出 features JSON。
     */
    public void write(Path file) throws IOException {
        OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), source);
    }

    public List<Feature> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public Optional<Feature> find(String name) {
        return columns.stream().filter(column -> column.name().equals(name)).findFirst();
    }

    /**
     * 含有字符串叶子（含嵌套）的列名，按 schema 顺序。
     */
    public List<String> indexableColumns() {
        return columns.stream()
            .filter(column -> column.type().containsText())
            .map(Feature::name)
            .toList();
    }

    public boolean hasIndexableColumns() {
        return columns.stream().anyMatch(column -> column.type().containsText());
    }

    /**
     * 转为响应中的有序列描述列表。
     */
    public List<FeatureItem> toFeaturesList() {
        return columns.stream()
            .map(column -> new FeatureItem(column.index(), column.name(), column.descriptor()))
            .toList();
    }
}
