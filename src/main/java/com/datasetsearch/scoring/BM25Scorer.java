package com.datasetsearch.scoring;

import com.datasetsearch.config.Constants;

/**
 * BM25 打分。IDF 采用 {@code ln((N - df + 0.5) / (df + 0.5) + 1)}，恒为正，
 * 因此任何 tf >= 1 的行得分都大于0。
 */
public class BM25Scorer {
    private final int totalRows;
    private final double avgRowLength;
    private final double k1;
    private final double b;

    public BM25Scorer(int totalRows, double avgRowLength) {
        this(totalRows, avgRowLength, Constants.BM25_K1, Constants.BM25_B);
    }

    public BM25Scorer(int totalRows, double avgRowLength, double k1, double b) {
        if (k1 < 0) {
            throw new IllegalArgumentException("k1 不能为负数: " + k1);
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("b 必须在 [0, 1] 内: " + b);
        }
        this.totalRows = Math.max(totalRows, 1);
        this.avgRowLength = avgRowLength <= 0 ? 1.0 : avgRowLength;
        this.k1 = k1;
        this.b = b;
    }

    public double computeIDF(int rowFrequency) {
        int boundedDf = Math.max(0, Math.min(rowFrequency, totalRows));
        return Math.log((totalRows - boundedDf + 0.5) / (boundedDf + 0.5) + 1);
    }

    public double score(int termFrequency, int rowFrequency, int rowLength) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        double normalizedRowLength = Math.max(rowLength, 0);
        double norm = 1 - b + b * (normalizedRowLength / avgRowLength);
        return computeIDF(rowFrequency) * (termFrequency * (k1 + 1)) / (termFrequency + k1 * norm);
    }
}
