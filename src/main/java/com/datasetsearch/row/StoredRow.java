package com.datasetsearch.row;

/**
 * 行存储中的一行，content 为该行的 JSON 文本。
 */
public record StoredRow(int rowIndex, String content) {
}
