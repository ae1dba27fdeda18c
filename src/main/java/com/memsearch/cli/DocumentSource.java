package com.memsearch.cli;

import com.memsearch.document.DocumentStatus;

import java.util.List;

/**
 * 文档输入文件中的一条记录。
 */
public record DocumentSource(
        int id,
        String text,
        DocumentStatus status,
        List<Integer> ratings
) {
    public DocumentSource {
        text = text == null ? "" : text;
        status = status == null ? DocumentStatus.ACTIVE : status;
        ratings = ratings == null ? List.of() : List.copyOf(ratings);
    }
}
