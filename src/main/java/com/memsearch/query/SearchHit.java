package com.memsearch.query;

public record SearchHit(
        int docId,
        double relevance,
        int rating
) {
}
