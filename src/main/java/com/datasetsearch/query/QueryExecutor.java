package com.datasetsearch.query;

import com.datasetsearch.config.Constants;
import com.datasetsearch.config.EngineConfig;
import com.datasetsearch.error.IndexNotFoundException;
import com.datasetsearch.error.RowStoreException;
import com.datasetsearch.index.IndexStore;
import com.datasetsearch.index.InvertedIndex;
import com.datasetsearch.index.PublishedIndex;
import com.datasetsearch.schema.Feature;
import com.datasetsearch.schema.Features;
import com.datasetsearch.scoring.BM25Scorer;
import com.datasetsearch.storage.PostingList;
import com.datasetsearch.text.PorterStemmingTokenizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 查询执行器。
 *
 * BM25 得分只用于判断一行是否命中，输出始终按 row_idx 升序，不按相关度排序。
 * 索引不可变，同一查询与分页参数在同一版本上结果恒定。
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final IndexStore indexStore;
    private final RowStore rowStore;
    private final BuildTrigger buildTrigger;
    private final PorterStemmingTokenizer tokenizer;
    private final double k1;
    private final double b;

    public QueryExecutor(IndexStore indexStore, RowStore rowStore, BuildTrigger buildTrigger, EngineConfig config) {
        this.indexStore = indexStore;
        this.rowStore = rowStore;
        this.buildTrigger = buildTrigger;
        this.tokenizer = new PorterStemmingTokenizer(config.isStopWordsEnabled());
        this.k1 = config.getBm25K1();
        this.b = config.getBm25B();
    }

    /**
     * 执行搜索。
     *
     * @param request 已校验的请求
     * @return 搜索响应
     * @throws IndexNotFoundException 索引尚未构建时抛出，同时已提交构建
     * @throws RowStoreException 读取索引或行存储失败时抛出
     */
    public SearchResponse execute(SearchRequest request) {
        long startNanos = System.nanoTime();
        Optional<PublishedIndex> found = indexStore.find(request.key());
        if (found.isEmpty()) {
            logger.info("索引不存在，提交构建: split={}", request.key());
            buildTrigger.requestBuild(request.key());
            throw new IndexNotFoundException(request.key());
        }
        PublishedIndex published = found.get();

        int[] matches = findMatches(published.index(), request.query());
        int from = (int) Math.min(request.offset(), matches.length);
        int to = (int) Math.min((long) request.offset() + request.length(), matches.length);
        List<Integer> page = new ArrayList<>(to - from);
        for (int index = from; index < to; index++) {
            page.add(matches[index]);
        }

        List<ResultRow> rows = fetchPage(published, page);
        long elapsedMicros = (System.nanoTime() - startNanos) / 1_000;
        logger.debug("查询完成: split={}, version={}, query='{}', total={}, returned={}, 耗时={}us",
            request.key(), published.version(), request.query(), matches.length, rows.size(), elapsedMicros);
        return new SearchResponse(
            published.features().toFeaturesList(),
            rows,
            matches.length,
            Constants.MAX_ROWS_PER_PAGE,
            published.index().isPartial());
    }

    /**
     * 计算全部命中行号，按升序返回。查询没有任何词项时返回空数组。
     *
     * 每个词项的 BM25 贡献都非负，所以总分为正等价于至少一个词项的贡献为正，
     * 命中集合就是各词项正分行号的并集。
     */
    int[] findMatches(InvertedIndex index, String query) {
        Set<String> queryTerms = new LinkedHashSet<>(tokenizer.terms(query).toList());
        if (queryTerms.isEmpty()) {
            return new int[0];
        }
        BM25Scorer scorer = new BM25Scorer(index.rowsIndexed(), index.averageRowLength(), k1, b);
        int[] matches = new int[0];
        for (String term : queryTerms) {
            Optional<PostingList> postings = index.postings(term);
            if (postings.isPresent()) {
                matches = union(matches, positiveRows(postings.get(), scorer, index));
            }
        }
        return matches;
    }

    private int[] positiveRows(PostingList postingList, BM25Scorer scorer, InvertedIndex index) {
        int rowFrequency = postingList.size();
        int[] rows = new int[rowFrequency];
        int count = 0;
        for (int position = 0; position < rowFrequency; position++) {
            int rowIndex = postingList.rowIndex(position);
            if (scorer.score(postingList.termFreq(position), rowFrequency, index.rowLength(rowIndex)) > 0) {
                rows[count++] = rowIndex;
            }
        }
        return count == rows.length ? rows : Arrays.copyOf(rows, count);
    }

    /**
     * 合并两个严格升序数组，结果去重且保持升序。
     */
    static int[] union(int[] left, int[] right) {
        if (left.length == 0) {
            return right;
        }
        if (right.length == 0) {
            return left;
        }
        int[] merged = new int[left.length + right.length];
        int leftIndex = 0;
        int rightIndex = 0;
        int count = 0;
        while (leftIndex < left.length && rightIndex < right.length) {
            int leftValue = left[leftIndex];
            int rightValue = right[rightIndex];
            if (leftValue < rightValue) {
                merged[count++] = leftValue;
                leftIndex++;
            } else if (rightValue < leftValue) {
                merged[count++] = rightValue;
                rightIndex++;
            } else {
                merged[count++] = leftValue;
                leftIndex++;
                rightIndex++;
            }
        }
        while (leftIndex < left.length) {
            merged[count++] = left[leftIndex++];
        }
        while (rightIndex < right.length) {
            merged[count++] = right[rightIndex++];
        }
        return Arrays.copyOf(merged, count);
    }

    private List<ResultRow> fetchPage(PublishedIndex published, List<Integer> page) {
        Map<Integer, JsonNode> contents = rowStore.fetchRows(published, page);
        List<ResultRow> rows = new ArrayList<>(page.size());
        for (Integer rowIndex : page) {
            JsonNode content = contents.get(rowIndex);
            if (content == null) {
                throw new RowStoreException("行存储缺少已入索引的行: split=" + published.key() + ", rowIdx=" + rowIndex);
            }
            rows.add(new ResultRow(rowIndex, projectToSchema(content, published.features())));
        }
        return rows;
    }

    /**
     * 按 schema 列顺序输出行内容，缺失列以 null 填充，schema 之外的键丢弃。
     */
    private ObjectNode projectToSchema(JsonNode content, Features features) {
        ObjectNode row = JsonNodeFactory.instance.objectNode();
        for (Feature feature : features.columns()) {
            JsonNode value = content.get(feature.name());
            row.set(feature.name(), value == null ? JsonNodeFactory.instance.nullNode() : value);
        }
        return row;
    }
}
