package com.datasetsearch.query;

import com.datasetsearch.index.PublishedIndex;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * 按行号读取已入索引行的完整内容。
 */
public interface RowStore {

    /**
     * 读取指定行。
     *
     * @param index 行所属的索引版本
     * @param rowIndices 升序行号
     * @return 行号到行 JSON 对象的映射，不存在的行号不出现
     */
    Map<Integer, JsonNode> fetchRows(PublishedIndex index, List<Integer> rowIndices);
}
