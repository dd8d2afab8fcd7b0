package com.datasetsearch.extract;

/**
 * 从一行中抽取的一段可索引文本。
 *
 * @param columnName 顶层列名
 * @param path 嵌套路径，例如 {@code answers.text[0]}，顶层字符串列与列名相同
 * @param text 原始文本
 */
public record ExtractedField(String columnName, String path, String text) {
}
