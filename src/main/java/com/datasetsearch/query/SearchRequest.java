package com.datasetsearch.query;

import com.datasetsearch.config.Constants;
import com.datasetsearch.error.ValidationException;
import com.datasetsearch.index.SplitKey;

/**
 * 校验后的搜索请求。
 *
 * @param key split 标识
 * @param query 去掉首尾空白后的查询串
 * @param offset 起始位置，>= 0
 * @param length 返回行数，1 到 100
 */
public record SearchRequest(SplitKey key, String query, int offset, int length) {

    public SearchRequest {
        if (key == null) {
            throw new ValidationException("dataset", "split 标识不能为空");
        }
        if (query == null || query.isBlank()) {
            throw new ValidationException("query", "查询不能为空");
        }
        query = query.trim();
        if (query.length() > Constants.MAX_QUERY_LENGTH) {
            throw new ValidationException("query", "长度超过 " + Constants.MAX_QUERY_LENGTH);
        }
        if (offset < 0) {
            throw new ValidationException("offset", "不能为负数: " + offset);
        }
        if (length < 1 || length > Constants.MAX_ROWS_PER_PAGE) {
            throw new ValidationException("length", "必须在 1 到 " + Constants.MAX_ROWS_PER_PAGE + " 之间: " + length);
        }
    }

    /**
     * 从原始请求参数构造，offset 与 length 缺省时分别取 0 和 100。
     */
    public static SearchRequest of(String dataset, String config, String split, String query,
                                   Integer offset, Integer length) {
        requireParameter("dataset", dataset);
        requireParameter("config", config);
        requireParameter("split", split);
        return new SearchRequest(
            new SplitKey(dataset, config, split),
            query,
            offset == null ? 0 : offset,
            length == null ? Constants.MAX_ROWS_PER_PAGE : length);
    }

    private static void requireParameter(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name, "不能为空");
        }
    }
}
