package com.datasetsearch.query;

import com.datasetsearch.config.EngineConfig;
import com.datasetsearch.dataset.RowSource;
import com.datasetsearch.error.ErrorCode;
import com.datasetsearch.error.IndexNotFoundException;
import com.datasetsearch.error.RowStoreException;
import com.datasetsearch.extract.TextExtractor;
import com.datasetsearch.index.FileIndexStore;
import com.datasetsearch.index.IndexBuilder;
import com.datasetsearch.index.InvertedIndex;
import com.datasetsearch.index.SplitKey;
import com.datasetsearch.row.CellValues;
import com.datasetsearch.row.SourceRow;
import com.datasetsearch.schema.Features;
import com.datasetsearch.text.PorterStemmingTokenizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryExecutorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SplitKey KEY = new SplitKey("user/animals", "default", "train");
    private static final String FEATURES_JSON = "{\"text\": {\"dtype\": \"string\", \"_type\": \"Value\"},"
        + " \"label\": {\"dtype\": \"int64\", \"_type\": \"Value\"}}";

    @TempDir
    Path tempDir;

    private FileIndexStore indexStore;
    private Map<Integer, JsonNode> storedRows;
    private List<SplitKey> buildRequests;
    private QueryExecutor executor;
    private Features features;

    @BeforeEach
    void setUp() throws Exception {
        indexStore = new FileIndexStore(tempDir, 2);
        storedRows = new HashMap<>();
        buildRequests = new ArrayList<>();
        features = Features.parse(MAPPER.readTree(FEATURES_JSON));
        RowStore rowStore = (index, rowIndices) -> {
            Map<Integer, JsonNode> rows = new LinkedHashMap<>();
            for (Integer rowIndex : rowIndices) {
                if (storedRows.containsKey(rowIndex)) {
                    rows.put(rowIndex, storedRows.get(rowIndex));
                }
            }
            return rows;
        };
        executor = new QueryExecutor(indexStore, rowStore, buildRequests::add, EngineConfig.defaults());
    }

    @Test
    @DisplayName("dog 命中第0行与第2行，按 row_idx 升序")
    void testScenarioQuery() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        SearchResponse response = executor.execute(request("dog", 0, 100));

        assertEquals(List.of(0, 2), rowIndices(response));
        assertEquals(2, response.numRowsTotal());
        assertEquals(100, response.numRowsPerPage());
        assertFalse(response.partial());
        assertEquals(2, response.features().size());
        assertEquals("text", response.features().get(0).name());
        assertEquals("label", response.features().get(1).name());
    }

    @Test
    @DisplayName("词形变化经词干化后仍能命中")
    void testStemmedQueryMatches() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        assertEquals(List.of(0, 2), rowIndices(executor.execute(request("DOGS", 0, 100))));
        assertEquals(List.of(2), rowIndices(executor.execute(request("barking", 0, 100))));
        assertEquals(List.of(0, 1, 2), rowIndices(executor.execute(request("cat dog", 0, 100))));
    }

    @Test
    void testNoMatch() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        SearchResponse response = executor.execute(request("xyz", 0, 100));

        assertTrue(response.rows().isEmpty());
        assertEquals(0, response.numRowsTotal());
        assertEquals(2, response.features().size());
    }

    @Test
    @DisplayName("只有标点的查询没有词项，返回空结果而不是错误")
    void testPunctuationOnlyQuery() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        SearchResponse response = executor.execute(request("?!...", 0, 100));

        assertTrue(response.rows().isEmpty());
        assertEquals(0, response.numRowsTotal());
    }

    @Test
    @DisplayName("预算只覆盖第0行时结果标记 partial")
    void testPartialIndex() throws Exception {
        List<SourceRow> rows = sampleRows();
        publish(rows, rows.get(0).byteSize());

        SearchResponse response = executor.execute(request("dog", 0, 100));

        assertEquals(List.of(0), rowIndices(response));
        assertEquals(1, response.numRowsTotal());
        assertTrue(response.partial());

        SearchResponse unindexedTerms = executor.execute(request("cats sleep bark loudly", 0, 100));
        assertTrue(unindexedTerms.rows().isEmpty());
        assertTrue(unindexedTerms.partial());
    }

    @Test
    @DisplayName("分页切片拼接等于完整结果，总数与分页无关")
    void testPaginationConsistency() throws Exception {
        List<SourceRow> rows = new ArrayList<>();
        for (int rowIndex = 0; rowIndex < 400; rowIndex++) {
            String text = rowIndex % 3 == 0 ? "a dog named " + rowIndex : "a cat named " + rowIndex;
            rows.add(row(rowIndex, "{\"text\": \"" + text + "\", \"label\": " + rowIndex + "}"));
        }
        publish(rows, Long.MAX_VALUE);

        SearchResponse firstPage = executor.execute(request("dog", 0, 100));
        List<Integer> collected = new ArrayList<>(rowIndices(firstPage));
        collected.addAll(rowIndices(executor.execute(request("dog", 100, 7))));
        int next = 107;
        while (next < firstPage.numRowsTotal()) {
            SearchResponse page = executor.execute(request("dog", next, 13));
            assertEquals(firstPage.numRowsTotal(), page.numRowsTotal());
            collected.addAll(rowIndices(page));
            next += 13;
        }

        assertEquals(134, firstPage.numRowsTotal());
        assertEquals(100, firstPage.rows().size());
        List<Integer> expected = new ArrayList<>();
        for (int rowIndex = 0; rowIndex < 400; rowIndex += 3) {
            expected.add(rowIndex);
        }
        assertEquals(expected, collected);
        assertEquals(expected.subList(10, 15), rowIndices(executor.execute(request("dog", 10, 5))));
    }

    @Test
    void testOffsetBeyondTotalReturnsEmptyPage() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        SearchResponse response = executor.execute(request("dog", 50, 10));

        assertTrue(response.rows().isEmpty());
        assertEquals(2, response.numRowsTotal());
    }

    @Test
    @DisplayName("同一查询重复执行结果一致")
    void testRepeatedQueryIsStable() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        SearchResponse first = executor.execute(request("dog bark", 0, 100));
        SearchResponse second = executor.execute(request("dog bark", 0, 100));

        assertEquals(MAPPER.writeValueAsString(first), MAPPER.writeValueAsString(second));
    }

    @Test
    @DisplayName("索引缺失时提交构建并报告未就绪")
    void testMissingIndexTriggersBuild() {
        IndexNotFoundException exception = assertThrows(IndexNotFoundException.class,
            () -> executor.execute(request("dog", 0, 100)));

        assertEquals(ErrorCode.INDEX_NOT_READY, exception.getErrorCode());
        assertTrue(exception.isRetryable());
        assertEquals(KEY, exception.getSplitKey());
        assertEquals(List.of(KEY), buildRequests);
    }

    @Test
    @DisplayName("行内容按 schema 列序输出，缺失列为 null，多余键丢弃")
    void testRowProjection() throws Exception {
        List<SourceRow> rows = List.of(
            row(0, "{\"extra\": 1, \"text\": \"dog food\"}"),
            row(1, "{\"label\": 7, \"text\": \"dog toy\"}"));
        publish(rows, Long.MAX_VALUE);

        SearchResponse response = executor.execute(request("dog", 0, 100));

        ResultRow first = response.rows().get(0);
        Iterator<String> fieldNames = first.row().fieldNames();
        assertEquals("text", fieldNames.next());
        assertEquals("label", fieldNames.next());
        assertFalse(fieldNames.hasNext());
        assertTrue(first.row().get("label").isNull());
        assertEquals(7, response.rows().get(1).row().get("label").asInt());
        assertTrue(first.truncatedCells().isEmpty());
    }

    @Test
    void testMissingStoredRowReported() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);
        storedRows.remove(2);

        assertThrows(RowStoreException.class, () -> executor.execute(request("dog", 0, 100)));
    }

    @Test
    @DisplayName("响应 JSON 使用约定的字段名")
    void testResponseJsonShape() throws Exception {
        publish(sampleRows(), Long.MAX_VALUE);

        JsonNode json = MAPPER.readTree(MAPPER.writeValueAsString(executor.execute(request("dog", 0, 1))));

        assertEquals(List.of("features", "rows", "num_rows_total", "num_rows_per_page", "partial"), fieldNames(json));
        assertEquals(0, json.get("features").get(0).get("feature_idx").asInt());
        assertEquals("Value", json.get("features").get(0).get("type").get("_type").asText());
        JsonNode firstRow = json.get("rows").get(0);
        assertEquals(List.of("row_idx", "row", "truncated_cells"), fieldNames(firstRow));
        assertEquals("The dog ran", firstRow.get("row").get("text").asText());
        assertEquals(2, json.get("num_rows_total").asInt());
        assertFalse(json.get("partial").asBoolean());
    }

    @Test
    @DisplayName("BM25 分数为正即命中，重复词项只计一次")
    void testFindMatchesUsesPositiveScore() throws Exception {
        InvertedIndex index = new IndexBuilder(new PorterStemmingTokenizer(false), new TextExtractor(), Long.MAX_VALUE)
            .build(RowSource.of(sampleRows()), features);

        assertArrayEquals(new int[]{0}, executor.findMatches(index, "the"));
        assertArrayEquals(new int[]{0, 2}, executor.findMatches(index, "dog dogs DOG"));
        assertArrayEquals(new int[0], executor.findMatches(index, "zebra"));
    }

    @Test
    @DisplayName("有序数组并集去重且保持升序")
    void testUnionOfSortedRows() {
        assertArrayEquals(new int[]{1, 2, 3, 5, 8, 9}, QueryExecutor.union(new int[]{1, 3, 5, 9}, new int[]{2, 3, 8, 9}));
        assertArrayEquals(new int[]{4, 7}, QueryExecutor.union(new int[0], new int[]{4, 7}));
        assertArrayEquals(new int[]{4, 7}, QueryExecutor.union(new int[]{4, 7}, new int[0]));
        assertArrayEquals(new int[]{4, 7}, QueryExecutor.union(new int[]{4, 7}, new int[]{4, 7}));
    }

    @Test
    @DisplayName("多词查询命中集合等于含任一词项的行")
    void testMultiTermMatchesAnyTerm() throws Exception {
        String[] words = {"dog", "cat", "bird", "fish", "horse"};
        List<SourceRow> rows = new ArrayList<>();
        List<Integer> expected = new ArrayList<>();
        for (int rowIndex = 0; rowIndex < 500; rowIndex++) {
            String first = words[rowIndex % words.length];
            String second = words[(rowIndex / 7) % words.length];
            rows.add(row(rowIndex, "{\"text\": \"" + first + " and " + second + "\", \"label\": 0}"));
            if (first.equals("bird") || second.equals("bird") || first.equals("fish") || second.equals("fish")) {
                expected.add(rowIndex);
            }
        }
        InvertedIndex index = new IndexBuilder(new PorterStemmingTokenizer(false), new TextExtractor(), Long.MAX_VALUE)
            .build(RowSource.of(rows), features);

        int[] matches = executor.findMatches(index, "birds fish");

        assertEquals(expected, Arrays.stream(matches).boxed().toList());
    }

    private void publish(List<SourceRow> rows, long budget) throws Exception {
        IndexBuilder builder = new IndexBuilder(new PorterStemmingTokenizer(false), new TextExtractor(), budget);
        InvertedIndex index = builder.build(RowSource.of(rows), features,
            row -> storedRows.put(row.rowIndex(), CellValues.rowToJson(row.cells())));
        indexStore.publish(indexStore.beginVersion(KEY), index, features);
    }

    private static SearchRequest request(String query, int offset, int length) {
        return new SearchRequest(KEY, query, offset, length);
    }

    private static List<Integer> rowIndices(SearchResponse response) {
        return response.rows().stream().map(ResultRow::rowIdx).toList();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static List<SourceRow> sampleRows() throws Exception {
        return List.of(
            row(0, "{\"text\": \"The dog ran\", \"label\": 0}"),
            row(1, "{\"text\": \"Cats sleep\", \"label\": 1}"),
            row(2, "{\"text\": \"dogs bark loudly\", \"label\": 0}"));
    }

    private static SourceRow row(int rowIndex, String json) throws Exception {
        long byteSize = json.getBytes(StandardCharsets.UTF_8).length + 1L;
        return SourceRow.of(rowIndex, byteSize, CellValues.rowFromJson(MAPPER.readTree(json)));
    }
}
