package com.memsearch.query;

import com.memsearch.document.DocumentStatus;

import java.util.List;

/**
 * 文档匹配结果：命中的加词（升序去重）与文档状态。
 */
public record MatchResult(
        List<String> words,
        DocumentStatus status
) {
    public MatchResult {
        words = List.copyOf(words);
    }
}
