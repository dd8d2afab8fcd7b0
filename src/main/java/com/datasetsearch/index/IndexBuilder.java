package com.datasetsearch.index;

import com.datasetsearch.dataset.RowSource;
import com.datasetsearch.error.StreamReadException;
import com.datasetsearch.extract.ExtractedField;
import com.datasetsearch.extract.ExtractionException;
import com.datasetsearch.extract.TextExtractor;
import com.datasetsearch.row.SourceRow;
import com.datasetsearch.schema.Features;
import com.datasetsearch.storage.PostingList;
import com.datasetsearch.storage.RowLengths;
import com.datasetsearch.text.PorterStemmingTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * 按行号顺序消费行流并构建倒排索引。
 *
 * 行的消费必须严格串行：预算截断点取决于按行号累计的字节数。
 * 预算耗尽时索引只覆盖行号前缀，并标记为 partial。
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final PorterStemmingTokenizer tokenizer;
    private final TextExtractor extractor;
    private final long byteBudget;

    public IndexBuilder(PorterStemmingTokenizer tokenizer, TextExtractor extractor, long byteBudget) {
        if (byteBudget < 0) {
            throw new IllegalArgumentException("byteBudget 不能为负数: " + byteBudget);
        }
        this.tokenizer = tokenizer;
        this.extractor = extractor;
        this.byteBudget = byteBudget;
    }

    public InvertedIndex build(RowSource rows, Features features) {
        return build(rows, features, row -> { });
    }

    /**
     * 构建索引。
     *
     * @param rows 按行号升序的行流
     * @param features split 的 schema
     * @param onIndexed 每成功入索引一行回调一次，用于同步写行存储
     * @return 构建完成的索引
     * @throws StreamReadException 行流读取失败或行号不递增时抛出，本次构建作废
     */
    public InvertedIndex build(RowSource rows, Features features, Consumer<SourceRow> onIndexed) {
        long startNanos = System.nanoTime();
        Map<String, PostingAccumulator> accumulators = new TreeMap<>();
        IntPairBuffer rowLengths = new IntPairBuffer();
        Map<String, Long> columnLengths = new TreeMap<>();
        long consumedBytes = 0;
        boolean partial = false;
        int rowsSkipped = 0;
        int previousRowIndex = -1;

        while (true) {
            Optional<SourceRow> next = readNext(rows, previousRowIndex);
            if (next.isEmpty()) {
                break;
            }
            SourceRow row = next.get();
            if (row.rowIndex() <= previousRowIndex) {
                throw new StreamReadException("行号未严格递增: previous=" + previousRowIndex + ", current=" + row.rowIndex());
            }
            previousRowIndex = row.rowIndex();

            if (consumedBytes + row.byteSize() > byteBudget) {
                partial = true;
                logger.info("字节预算耗尽，索引截断于 rowIdx={} 之前: consumed={}, rowBytes={}, budget={}",
                    row.rowIndex(), consumedBytes, row.byteSize(), byteBudget);
                break;
            }
            consumedBytes += row.byteSize();

            if (row.isMalformed()) {
                rowsSkipped++;
                logger.warn("跳过无法解析的行: rowIdx={}, reason={}", row.rowIndex(), row.malformedReason());
                continue;
            }
            List<ExtractedField> fields;
            try {
                fields = extractor.extract(row.cells(), features);
            } catch (ExtractionException exception) {
                rowsSkipped++;
                logger.warn("跳过文本抽取失败的行: rowIdx={}, path={}, reason={}",
                    row.rowIndex(), exception.getPath(), exception.getMessage());
                continue;
            }

            Map<String, Integer> termFreqs = new HashMap<>();
            int rowLength = 0;
            for (ExtractedField field : fields) {
                int fieldLength = 0;
                for (String term : tokenizer.terms(field.text())) {
                    termFreqs.merge(term, 1, Integer::sum);
                    fieldLength++;
                }
                if (fieldLength > 0) {
                    columnLengths.merge(field.columnName(), (long) fieldLength, Long::sum);
                }
                rowLength += fieldLength;
            }
            for (Map.Entry<String, Integer> entry : termFreqs.entrySet()) {
                accumulators.computeIfAbsent(entry.getKey(), term -> new PostingAccumulator())
                    .add(row.rowIndex(), entry.getValue());
            }
            rowLengths.add(row.rowIndex(), rowLength);
            onIndexed.accept(row);
        }

        Map<String, PostingList> postings = new TreeMap<>();
        accumulators.forEach((term, accumulator) -> postings.put(term, accumulator.toPostingList()));
        InvertedIndex index = new InvertedIndex(postings, new RowLengths(rowLengths.firsts(), rowLengths.seconds()),
            columnLengths, partial, consumedBytes, byteBudget, rowsSkipped);

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("索引构建完成: rows={}, skipped={}, terms={}, consumedBytes={}, partial={}, 耗时={}ms",
            index.rowsIndexed(), rowsSkipped, index.termCount(), consumedBytes, partial, elapsedMs);
        return index;
    }

    private Optional<SourceRow> readNext(RowSource rows, int previousRowIndex) {
        try {
            return rows.next();
        } catch (IOException exception) {
            throw new StreamReadException("读取行流失败，上一行 rowIdx=" + previousRowIndex, exception);
        }
    }

    /**
     * 单个词项的倒排累积，行号按追加顺序天然递增。
     */
    private static final class PostingAccumulator {
        private final IntPairBuffer buffer = new IntPairBuffer();

        void add(int rowIndex, int termFreq) {
            buffer.add(rowIndex, termFreq);
        }

        PostingList toPostingList() {
            return new PostingList(buffer.firsts(), buffer.seconds());
        }
    }

    /**
     * 可增长的 int 对数组，避免装箱。
     */
    private static final class IntPairBuffer {
        private int[] firsts = new int[4];
        private int[] seconds = new int[4];
        private int size;

        void add(int first, int second) {
            if (size == firsts.length) {
                int capacity = firsts.length * 2;
                firsts = Arrays.copyOf(firsts, capacity);
                seconds = Arrays.copyOf(seconds, capacity);
            }
            firsts[size] = first;
            seconds[size] = second;
            size++;
        }

        int[] firsts() {
            return Arrays.copyOf(firsts, size);
        }

        int[] seconds() {
            return Arrays.copyOf(seconds, size);
        }
    }
}
