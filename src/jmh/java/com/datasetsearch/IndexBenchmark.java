package com.datasetsearch;

import com.datasetsearch.config.EngineConfig;
import com.datasetsearch.dataset.RowSource;
import com.datasetsearch.extract.TextExtractor;
import com.datasetsearch.index.FileIndexStore;
import com.datasetsearch.index.IndexBuilder;
import com.datasetsearch.index.InvertedIndex;
import com.datasetsearch.index.SplitKey;
import com.datasetsearch.query.QueryExecutor;
import com.datasetsearch.query.SearchRequest;
import com.datasetsearch.row.CellValues;
import com.datasetsearch.row.SourceRow;
import com.datasetsearch.schema.Features;
import com.datasetsearch.text.PorterStemmingTokenizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引构建与查询性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FEATURES_JSON = "{\"text\": {\"dtype\": \"string\", \"_type\": \"Value\"},"
        + " \"tags\": {\"feature\": {\"dtype\": \"string\", \"_type\": \"Value\"}, \"_type\": \"Sequence\"}}";

    @State(Scope.Thread)
    public static class BuildState {
        Features features;
        List<SourceRow> rows;

        @Setup
        public void setup() throws IOException {
            features = Features.parse(MAPPER.readTree(FEATURES_JSON));
            // 10000行测试数据
            rows = generateRows(10_000);
        }
    }

    @Benchmark
    public InvertedIndex indexThroughput(BuildState state) throws IOException {
        IndexBuilder builder = new IndexBuilder(new PorterStemmingTokenizer(false), new TextExtractor(), Long.MAX_VALUE);
        return builder.build(RowSource.of(state.rows), state.features);
    }

    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        Path tempDir;
        QueryExecutor executor;
        SplitKey key = new SplitKey("bench/reviews", "default", "train");

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            Features features = Features.parse(MAPPER.readTree(FEATURES_JSON));
            List<SourceRow> rows = generateRows(100_000);
            Map<Integer, JsonNode> contents = new HashMap<>();

            FileIndexStore indexStore = new FileIndexStore(tempDir, 2);
            IndexBuilder builder = new IndexBuilder(new PorterStemmingTokenizer(false), new TextExtractor(), Long.MAX_VALUE);
            InvertedIndex index = builder.build(RowSource.of(rows), features,
                row -> contents.put(row.rowIndex(), CellValues.rowToJson(row.cells())));
            indexStore.publish(indexStore.beginVersion(key), index, features);

            // 行存储放内存里，只测倒排与打分
            executor = new QueryExecutor(indexStore, (published, rowIndices) -> {
                Map<Integer, JsonNode> page = new LinkedHashMap<>();
                rowIndices.forEach(rowIndex -> page.put(rowIndex, contents.get(rowIndex)));
                return page;
            }, key -> { }, EngineConfig.defaults());
        }

        @TearDown
        public void tearDown() throws IOException {
            if (!Files.exists(tempDir)) return;
            try (Stream<Path> paths = Files.walk(tempDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencySingleTerm(QueryLatencyState state) {
        return state.executor.execute(new SearchRequest(state.key, "programming", 0, 100)).numRowsTotal();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyMultiTerm(QueryLatencyState state) {
        return state.executor.execute(new SearchRequest(state.key, "machine learning data", 0, 100)).numRowsTotal();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int queryLatencyDeepPage(QueryLatencyState state) {
        return state.executor.execute(new SearchRequest(state.key, "content", 50_000, 100)).rows().size();
    }

    private static List<SourceRow> generateRows(int count) throws IOException {
        List<SourceRow> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String topic = i % 10 == 0 ? "Java programming"
                : i % 10 == 1 ? "Python data science"
                : i % 10 == 2 ? "machine learning"
                : "general content";
            String json = "{\"text\": \"Row " + i + " about " + topic
                + " with various keywords for search testing. The quick brown fox jumps over the lazy dog.\","
                + " \"tags\": [\"tag" + (i % 50) + "\", \"" + topic + "\"]}";
            long byteSize = json.getBytes(StandardCharsets.UTF_8).length + 1L;
            rows.add(SourceRow.of(i, byteSize, CellValues.rowFromJson(MAPPER.readTree(json))));
        }
        return rows;
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
