package com.datasetsearch.index;

/**
 * 索引版本目录中的文件名。
 */
public final class IndexFiles {
    public static final String DICTIONARY = "terms.dict";
    public static final String POSTINGS = "postings.inv";
    public static final String FEATURES = "features.json";
    public static final String META = "meta.json";
    public static final String ROWS_DB = "rows.db";
    public static final String CURRENT = "CURRENT";
    public static final String VERSION_PREFIX = "v";

    private IndexFiles() {
    }
}
