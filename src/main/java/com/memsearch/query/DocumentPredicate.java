package com.memsearch.query;

import com.memsearch.document.DocumentStatus;

/**
 * 按文档 ID、状态与评分过滤候选文档。
 */
@FunctionalInterface
public interface DocumentPredicate {

    boolean test(int docId, DocumentStatus status, int rating);

    static DocumentPredicate withStatus(DocumentStatus expected) {
        return (docId, status, rating) -> status == expected;
    }

    static DocumentPredicate active() {
        return withStatus(DocumentStatus.ACTIVE);
    }
}
