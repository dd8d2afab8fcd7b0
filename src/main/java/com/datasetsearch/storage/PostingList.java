package com.datasetsearch.storage;

import java.util.Arrays;

/**
 * 倒排列表，包含行号与对应词频。
 *
 * @param rowIndices 严格递增的行号数组
 * @param termFreqs 与rowIndices同长度的词频数组，每项至少为1
 */
public record PostingList(int[] rowIndices, int[] termFreqs) {
    /**
     * 构造时校验并复制输入数据。
     */
    public PostingList {
        if (rowIndices == null || termFreqs == null) {
            throw new IllegalArgumentException("rowIndices与termFreqs不能为null");
        }
        if (rowIndices.length != termFreqs.length) {
            throw new IllegalArgumentException("rowIndices与termFreqs长度不一致: " + rowIndices.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < rowIndices.length; index++) {
            if (rowIndices[index] < 0) {
                throw new IllegalArgumentException("rowIdx不能为负数，位置=" + index + ", value=" + rowIndices[index]);
            }
            if (termFreqs[index] < 1) {
                throw new IllegalArgumentException("termFreq必须至少为1，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && rowIndices[index] <= rowIndices[index - 1]) {
                throw new IllegalArgumentException("rowIndices必须严格递增，位置=" + index + ", current=" + rowIndices[index]);
            }
        }
        rowIndices = Arrays.copyOf(rowIndices, rowIndices.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    /**
     * 返回倒排项数量，即包含该词的行数。
     */
    public int size() {
        return rowIndices.length;
    }

    public int rowIndex(int index) {
        return rowIndices[index];
    }

    public int termFreq(int index) {
        return termFreqs[index];
    }

    @Override
    public int[] rowIndices() {
        return Arrays.copyOf(rowIndices, rowIndices.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(rowIndices, that.rowIndices) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rowIndices) + Arrays.hashCode(termFreqs);
    }

    @Override
    public String toString() {
        return "PostingList[rowIndices=" + Arrays.toString(rowIndices) + ", termFreqs=" + Arrays.toString(termFreqs) + "]";
    }
}
