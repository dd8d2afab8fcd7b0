package com.datasetsearch.storage;

import java.util.Arrays;

/**
 * 已入索引行的词项总数，用于 BM25 的长度归一化。
 *
 * @param rowIndices 严格递增的行号
 * @param lengths 对应行的词项数，可以为0
 */
public record RowLengths(int[] rowIndices, int[] lengths) {

    public RowLengths {
        if (rowIndices == null || lengths == null || rowIndices.length != lengths.length) {
            throw new IllegalArgumentException("rowIndices 与 lengths 必须非空且长度一致");
        }
        rowIndices = Arrays.copyOf(rowIndices, rowIndices.length);
        lengths = Arrays.copyOf(lengths, lengths.length);
    }

    public int size() {
        return rowIndices.length;
    }

    public int rowIndex(int index) {
        return rowIndices[index];
    }

    public int length(int index) {
        return lengths[index];
    }

    /**
     * 按行号查找长度，行不在索引中返回 -1。
     */
    public int lengthOf(int rowIndex) {
        int position = Arrays.binarySearch(rowIndices, rowIndex);
        return position >= 0 ? lengths[position] : -1;
    }

    public boolean contains(int rowIndex) {
        return Arrays.binarySearch(rowIndices, rowIndex) >= 0;
    }

    public long totalLength() {
        long total = 0;
        for (int length : lengths) {
            total += length;
        }
        return total;
    }

    @Override
    public int[] rowIndices() {
        return Arrays.copyOf(rowIndices, rowIndices.length);
    }

    @Override
    public int[] lengths() {
        return Arrays.copyOf(lengths, lengths.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RowLengths that)) {
            return false;
        }
        return Arrays.equals(rowIndices, that.rowIndices) && Arrays.equals(lengths, that.lengths);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rowIndices) + Arrays.hashCode(lengths);
    }
}
