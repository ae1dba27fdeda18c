package com.memsearch.query;

import java.util.List;

/**
 * 解析后的查询：plusWords 必须出现，minusWords 必须不出现。
 */
public record ParsedQuery(
        List<String> plusWords,
        List<String> minusWords
) {
    public ParsedQuery {
        plusWords = List.copyOf(plusWords);
        minusWords = List.copyOf(minusWords);
    }

    public boolean isEmpty() {
        return plusWords.isEmpty() && minusWords.isEmpty();
    }
}
