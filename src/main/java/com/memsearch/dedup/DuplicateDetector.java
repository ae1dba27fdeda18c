package com.memsearch.dedup;

import com.memsearch.SearchServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 删除索引词集合完全相同的文档，每组只保留 ID 最小者。
 */
public class DuplicateDetector {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);

    /**
     * 按 ID 升序扫描并返回被判定为重复的文档 ID，不修改索引。
     */
    public List<Integer> findDuplicates(SearchServer server) {
        Set<Set<String>> seenTermSets = new HashSet<>();
        List<Integer> duplicates = new ArrayList<>();
        for (int docId : server) {
            Set<String> terms = Set.copyOf(server.getWordFrequencies(docId).keySet());
            if (!seenTermSets.add(terms)) {
                logger.info("Found duplicate document id {}", docId);
                duplicates.add(docId);
            }
        }
        return duplicates;
    }

    /**
     * 扫描完成后逐个删除重复文档，返回被删除的 ID（升序）。
     */
    public List<Integer> removeDuplicates(SearchServer server) {
        List<Integer> duplicates = findDuplicates(server);
        for (int docId : duplicates) {
            server.removeDocument(docId);
        }
        if (!duplicates.isEmpty()) {
            logger.info("已删除 {} 个重复文档，剩余 {} 个", duplicates.size(), server.getDocumentCount());
        }
        return duplicates;
    }
}
