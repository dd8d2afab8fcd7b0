package com.datasetsearch.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单元格取值：标量、列表或结构体，可任意嵌套。
 */
public sealed interface CellValue permits CellValue.Text, CellValue.Numeric, CellValue.Bool,
        CellValue.ListCell, CellValue.StructCell, CellValue.NullCell {

    record Text(String value) implements CellValue {
    }

    record Numeric(Number value) implements CellValue {
    }

    record Bool(boolean value) implements CellValue {
    }

    record ListCell(List<CellValue> elements) implements CellValue {
        public ListCell {
            elements = List.copyOf(elements);
        }
    }

    record StructCell(Map<String, CellValue> fields) implements CellValue {
        public StructCell {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    record NullCell() implements CellValue {
        public static final NullCell INSTANCE = new NullCell();
    }
}
