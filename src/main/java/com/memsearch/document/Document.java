package com.memsearch.document;

import java.util.List;
import java.util.Objects;

/**
 * 已索引文档的元数据与原文副本。
 */
public record Document(
        int docId,
        int rating,
        DocumentStatus status,
        String text
) {
    public Document {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(text, "text");
    }

    public static Document of(int docId, String text, DocumentStatus status, List<Integer> ratings) {
        return new Document(docId, computeAverageRating(ratings), status, text == null ? "" : text);
    }

    /**
     * 计算评分的截断平均值，空列表返回 0。
     */
    public static int computeAverageRating(List<Integer> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return 0;
        }
        long ratingSum = 0;
        for (Integer rating : ratings) {
            ratingSum += rating;
        }
        return (int) (ratingSum / ratings.size());
    }
}
