package com.memsearch.scoring;

public class TfIdfScorer {
    private final int totalDocs;

    public TfIdfScorer(int totalDocs) {
        if (totalDocs < 0) {
            throw new IllegalArgumentException("文档总数不能为负数: " + totalDocs);
        }
        this.totalDocs = totalDocs;
    }

    public int getTotalDocs() {
        return totalDocs;
    }

    /**
     * ln(N / df)，df 必须落在 [1, N] 内。
     */
    public double computeIDF(int docFrequency) {
        if (docFrequency <= 0 || docFrequency > totalDocs) {
            throw new IllegalArgumentException(
                    "文档频率越界: df=" + docFrequency + ", totalDocs=" + totalDocs);
        }
        return Math.log(totalDocs * 1.0 / docFrequency);
    }

    /**
     * 单个词对文档的相关度贡献：tf × idf。
     */
    public double score(double termFrequency, double idf) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        return termFrequency * idf;
    }
}
