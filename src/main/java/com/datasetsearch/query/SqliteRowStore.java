package com.datasetsearch.query;

import com.datasetsearch.error.RowStoreException;
import com.datasetsearch.index.PublishedIndex;
import com.datasetsearch.row.RowTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从索引版本目录内的 SQLite 行表读取行，行表与索引一起发布、一起切换。
 */
public class SqliteRowStore implements RowStore {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public Map<Integer, JsonNode> fetchRows(PublishedIndex index, List<Integer> rowIndices) {
        Map<Integer, JsonNode> rows = new LinkedHashMap<>();
        if (rowIndices.isEmpty()) {
            return rows;
        }
        Path dbPath = index.rowStorePath();
        if (!Files.isRegularFile(dbPath)) {
            throw new RowStoreException("行存储不存在: split=" + index.key() + ", version=" + index.version());
        }
        try (RowTable rowTable = new RowTable(dbPath)) {
            for (Map.Entry<Integer, String> entry : rowTable.findByRowIndices(rowIndices).entrySet()) {
                rows.put(entry.getKey(), OBJECT_MAPPER.readTree(entry.getValue()));
            }
        } catch (IllegalStateException exception) {
            throw new RowStoreException("读取行存储失败: split=" + index.key() + ", version=" + index.version(), exception);
        } catch (JsonProcessingException exception) {
            throw new RowStoreException("行内容不是合法 JSON: split=" + index.key(), exception);
        }
        return rows;
    }
}
