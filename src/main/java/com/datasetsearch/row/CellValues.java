package com.datasetsearch.row;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 与 {@link CellValue} 之间的转换。
 */
public final class CellValues {
    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;

    private CellValues() {
    }

    public static CellValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return CellValue.NullCell.INSTANCE;
        }
        if (node.isTextual()) {
            return new CellValue.Text(node.textValue());
        }
        if (node.isBoolean()) {
            return new CellValue.Bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return new CellValue.Numeric(node.numberValue());
        }
        if (node.isArray()) {
            List<CellValue> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(fromJson(element)));
            return new CellValue.ListCell(elements);
        }
        if (node.isObject()) {
            Map<String, CellValue> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                fields.put(field.getKey(), fromJson(field.getValue()));
            }
            return new CellValue.StructCell(fields);
        }
        // 二进制等其它节点按文本保存
        return new CellValue.Text(node.asText());
    }

    /**
     * 将一整行 JSON 对象转换为列名到单元格的映射。
     */
    public static Map<String, CellValue> rowFromJson(JsonNode rowNode) {
        if (rowNode == null || !rowNode.isObject()) {
            throw new IllegalArgumentException("行必须是 JSON 对象");
        }
        CellValue.StructCell struct = (CellValue.StructCell) fromJson(rowNode);
        return struct.fields();
    }

    public static JsonNode toJson(CellValue value) {
        if (value == null || value instanceof CellValue.NullCell) {
            return NODE_FACTORY.nullNode();
        }
        if (value instanceof CellValue.Text text) {
            return NODE_FACTORY.textNode(text.value());
        }
        if (value instanceof CellValue.Bool bool) {
            return NODE_FACTORY.booleanNode(bool.value());
        }
        if (value instanceof CellValue.Numeric numeric) {
            return numberNode(numeric.value());
        }
        if (value instanceof CellValue.ListCell list) {
            ArrayNode arrayNode = NODE_FACTORY.arrayNode();
            list.elements().forEach(element -> arrayNode.add(toJson(element)));
            return arrayNode;
        }
        CellValue.StructCell struct = (CellValue.StructCell) value;
        ObjectNode objectNode = NODE_FACTORY.objectNode();
        struct.fields().forEach((name, field) -> objectNode.set(name, toJson(field)));
        return objectNode;
    }

    public static ObjectNode rowToJson(Map<String, CellValue> cells) {
        ObjectNode objectNode = NODE_FACTORY.objectNode();
        cells.forEach((name, cell) -> objectNode.set(name, toJson(cell)));
        return objectNode;
    }

    private static JsonNode numberNode(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return NODE_FACTORY.numberNode(number.intValue());
        }
        if (number instanceof Long) {
            return NODE_FACTORY.numberNode(number.longValue());
        }
        if (number instanceof BigInteger bigInteger) {
            return NODE_FACTORY.numberNode(bigInteger);
        }
        if (number instanceof BigDecimal bigDecimal) {
            return NODE_FACTORY.numberNode(bigDecimal);
        }
        if (number instanceof Float) {
            return NODE_FACTORY.numberNode(number.floatValue());
        }
        return NODE_FACTORY.numberNode(number.doubleValue());
    }
}
