package com.datasetsearch.storage;

/**
 * 词典词条，记录词项的行频次及其倒排列表在文件中的偏移。
 */
public record TermEntry(String term, int rowFreq, long postingsOffset) {
}
