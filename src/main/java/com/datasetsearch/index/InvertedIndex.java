package com.datasetsearch.index;

import com.datasetsearch.storage.PostingList;
import com.datasetsearch.storage.RowLengths;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 一个 split 的只读倒排索引：词项到倒排列表的映射、每行与每列的词项数、预算统计。
 *
 * 构造后不可变，可被任意数量的查询并发读取。重建时整体替换，不做增量修改。
 */
public final class InvertedIndex {
    private final NavigableMap<String, PostingList> postings;
    private final RowLengths rowLengths;
    private final Map<String, Long> columnLengths;
    private final boolean partial;
    private final long consumedBytes;
    private final long byteBudget;
    private final int rowsSkipped;
    private final double averageRowLength;

    public InvertedIndex(Map<String, PostingList> postings, RowLengths rowLengths, Map<String, Long> columnLengths,
                         boolean partial, long consumedBytes, long byteBudget, int rowsSkipped) {
        Objects.requireNonNull(postings, "postings");
        Objects.requireNonNull(rowLengths, "rowLengths");
        Objects.requireNonNull(columnLengths, "columnLengths");
        if (consumedBytes < 0 || byteBudget < 0) {
            throw new IllegalArgumentException("字节统计不能为负数: consumed=" + consumedBytes + ", budget=" + byteBudget);
        }
        if (consumedBytes > byteBudget) {
            throw new IllegalArgumentException("已消费字节超过预算: consumed=" + consumedBytes + ", budget=" + byteBudget);
        }
        this.postings = Collections.unmodifiableNavigableMap(new TreeMap<>(postings));
        this.rowLengths = rowLengths;
        this.columnLengths = Collections.unmodifiableMap(new TreeMap<>(columnLengths));
        this.partial = partial;
        this.consumedBytes = consumedBytes;
        this.byteBudget = byteBudget;
        this.rowsSkipped = rowsSkipped;
        this.averageRowLength = rowLengths.size() == 0 ? 0.0 : (double) rowLengths.totalLength() / rowLengths.size();
    }

    public Optional<PostingList> postings(String term) {
        return Optional.ofNullable(postings.get(term));
    }

    /**
     * 包含该词项的行数，词项不存在时为0。
     */
    public int rowFrequency(String term) {
        PostingList postingList = postings.get(term);
        return postingList == null ? 0 : postingList.size();
    }

    public NavigableMap<String, PostingList> allPostings() {
        return postings;
    }

    public int termCount() {
        return postings.size();
    }

    public RowLengths rowLengths() {
        return rowLengths;
    }

    /**
     * 行的词项数，行未入索引时返回 -1。
     */
    public int rowLength(int rowIndex) {
        return rowLengths.lengthOf(rowIndex);
    }

    /**
     * 每个顶层列在已入索引行中的词项总数，没有产生任何词项的列不出现。
     */
    public Map<String, Long> columnLengths() {
        return columnLengths;
    }

    /**
     * 列在已入索引行上的平均词项数，列不存在或没有入索引行时为0。
     */
    public double averageColumnLength(String columnName) {
        Long total = columnLengths.get(columnName);
        return total == null || rowLengths.size() == 0 ? 0.0 : (double) total / rowLengths.size();
    }

    public int rowsIndexed() {
        return rowLengths.size();
    }

    public int rowsSkipped() {
        return rowsSkipped;
    }

    public double averageRowLength() {
        return averageRowLength;
    }

    public boolean isPartial() {
        return partial;
    }

    public long consumedBytes() {
        return consumedBytes;
    }

    public long byteBudget() {
        return byteBudget;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InvertedIndex that)) {
            return false;
        }
        return partial == that.partial
            && consumedBytes == that.consumedBytes
            && byteBudget == that.byteBudget
            && rowsSkipped == that.rowsSkipped
            && postings.equals(that.postings)
            && rowLengths.equals(that.rowLengths)
            && columnLengths.equals(that.columnLengths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(postings, rowLengths, columnLengths, partial, consumedBytes, byteBudget, rowsSkipped);
    }

    @Override
    public String toString() {
        return "InvertedIndex[terms=" + postings.size() + ", rows=" + rowLengths.size()
            + ", skipped=" + rowsSkipped + ", partial=" + partial
            + ", consumedBytes=" + consumedBytes + ", byteBudget=" + byteBudget + "]";
    }
}
