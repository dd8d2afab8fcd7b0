package com.datasetsearch.extract;

import com.datasetsearch.row.CellValue;
import com.datasetsearch.schema.Feature;
import com.datasetsearch.schema.FeatureType;
import com.datasetsearch.schema.Features;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 按 schema 遍历一行的取值树，收集所有字符串叶子。
 *
 * 纯函数，无状态，可被多个建索引线程共享。
 */
public class TextExtractor {
    /** 嵌套深度上限，表格 schema 不会出现环 */
    static final int MAX_DEPTH = 64;

    /**
     * 抽取一行中全部可索引文本，顺序为 schema 列顺序、列表元素顺序。
     *
     * @param cells 列名到取值的映射
     * @param features split 的 schema
     * @return 抽取结果
     * @throws ExtractionException 取值与 schema 声明不兼容时抛出
     */
    public List<ExtractedField> extract(Map<String, CellValue> cells, Features features) {
        List<ExtractedField> fields = new ArrayList<>();
        for (Feature feature : features.columns()) {
            if (!feature.type().containsText()) {
                continue;
            }
            CellValue cell = cells.get(feature.name());
            walk(feature.name(), feature.name(), feature.type(), cell, 0, fields);
        }
        return fields;
    }

    private void walk(String columnName, String path, FeatureType type, CellValue cell, int depth,
                      List<ExtractedField> output) {
        if (cell == null || cell instanceof CellValue.NullCell) {
            return;
        }
        if (depth > MAX_DEPTH) {
            throw new ExtractionException(path, "嵌套深度超过 " + MAX_DEPTH);
        }

        if (type instanceof FeatureType.ValueType valueType) {
            if (!valueType.isString()) {
                return;
            }
            if (!(cell instanceof CellValue.Text text)) {
                throw new ExtractionException(path, "字符串列的取值不是字符串: " + describe(cell));
            }
            output.add(new ExtractedField(columnName, path, text.value()));
            return;
        }
        if (type instanceof FeatureType.SequenceType sequenceType) {
            List<CellValue> elements = requireList(path, cell);
            if (sequenceType.length() >= 0 && elements.size() != sequenceType.length()) {
                throw new ExtractionException(path,
                    "列表长度与声明不一致: expected=" + sequenceType.length() + ", actual=" + elements.size());
            }
            walkElements(columnName, path, sequenceType.feature(), elements, depth, output);
            return;
        }
        if (type instanceof FeatureType.LargeListType largeListType) {
            walkElements(columnName, path, largeListType.feature(), requireList(path, cell), depth, output);
            return;
        }
        if (type instanceof FeatureType.StructType structType) {
            if (!(cell instanceof CellValue.StructCell struct)) {
                throw new ExtractionException(path, "结构体列的取值不是对象: " + describe(cell));
            }
            for (Map.Entry<String, FeatureType> field : structType.fields().entrySet()) {
                if (!field.getValue().containsText()) {
                    continue;
                }
                walk(columnName, path + "." + field.getKey(), field.getValue(),
                    struct.fields().get(field.getKey()), depth + 1, output);
            }
            return;
        }
        if (type instanceof FeatureType.TranslationType translationType) {
            if (!(cell instanceof CellValue.StructCell struct)) {
                throw new ExtractionException(path, "翻译列的取值不是对象: " + describe(cell));
            }
            if (translationType.variableLanguages()) {
                // {language: [...], translation: [...]}，只索引译文
                CellValue translations = struct.fields().get("translation");
                collectText(columnName, path + ".translation", translations, depth + 1, output);
            } else {
                struct.fields().forEach((language, text) ->
                    collectText(columnName, path + "." + language, text, depth + 1, output));
            }
        }
        // ClassLabel、多维数组与媒体列不含文本
    }

    private void walkElements(String columnName, String path, FeatureType elementType, List<CellValue> elements,
                              int depth, List<ExtractedField> output) {
        for (int index = 0; index < elements.size(); index++) {
            walk(columnName, path + "[" + index + "]", elementType, elements.get(index), depth + 1, output);
        }
    }

    private void collectText(String columnName, String path, CellValue cell, int depth, List<ExtractedField> output) {
        if (cell == null || cell instanceof CellValue.NullCell) {
            return;
        }
        if (depth > MAX_DEPTH) {
            throw new ExtractionException(path, "嵌套深度超过 " + MAX_DEPTH);
        }
        if (cell instanceof CellValue.Text text) {
            output.add(new ExtractedField(columnName, path, text.value()));
        } else if (cell instanceof CellValue.ListCell list) {
            for (int index = 0; index < list.elements().size(); index++) {
                collectText(columnName, path + "[" + index + "]", list.elements().get(index), depth + 1, output);
            }
        } else {
            throw new ExtractionException(path, "翻译文本不是字符串: " + describe(cell));
        }
    }

    private List<CellValue> requireList(String path, CellValue cell) {
        if (!(cell instanceof CellValue.ListCell list)) {
            throw new ExtractionException(path, "列表列的取值不是列表: " + describe(cell));
        }
        return list.elements();
    }

    private String describe(CellValue cell) {
        return cell.getClass().getSimpleName();
    }
}
