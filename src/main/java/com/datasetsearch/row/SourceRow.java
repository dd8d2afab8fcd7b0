package com.datasetsearch.row;

import java.util.Map;

/**
 * 行流中的一行：行号、序列化后的字节数与各列取值。
 *
 * @param rowIndex split 内的行号，严格递增
 * @param byteSize 该行序列化后的字节数，计入建索引预算
 * @param cells 列名到取值的映射，行无法解析时为空映射
 * @param malformedReason 行无法解析时的原因，正常行为 null
 */
public record SourceRow(int rowIndex, long byteSize, Map<String, CellValue> cells, String malformedReason) {

    public SourceRow {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex 不能为负数: " + rowIndex);
        }
        if (byteSize < 0) {
            throw new IllegalArgumentException("byteSize 不能为负数: " + byteSize);
        }
        cells = cells == null ? Map.of() : cells;
    }

    public static SourceRow of(int rowIndex, long byteSize, Map<String, CellValue> cells) {
        return new SourceRow(rowIndex, byteSize, cells, null);
    }

    public static SourceRow malformed(int rowIndex, long byteSize, String reason) {
        return new SourceRow(rowIndex, byteSize, Map.of(), reason);
    }

    public boolean isMalformed() {
        return malformedReason != null;
    }
}
