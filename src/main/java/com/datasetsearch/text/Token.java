package com.datasetsearch.text;

/**
 * 归一化后的词项及其在文本中的序号。
 */
public record Token(
    String term,
    int position
) {
}
