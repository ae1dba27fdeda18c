package com.memsearch.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 内存文档元数据表，按 docId 升序保存。
 *
 * 非线程安全，由持有者负责读写互斥。
 */
public final class DocumentTable {
    private final NavigableMap<Integer, Document> documents = new TreeMap<>();

    /**
     * 插入文档元数据，docId 已存在时返回 false 且不修改表。
     */
    public boolean insert(Document document) {
        return documents.putIfAbsent(document.docId(), document) == null;
    }

    /**
     * 按 ID 查找文档。
     */
    public Optional<Document> findById(int docId) {
        return Optional.ofNullable(documents.get(docId));
    }

    public boolean contains(int docId) {
        return documents.containsKey(docId);
    }

    /**
     * 按 ID 删除文档并返回被删除的记录。
     */
    public Optional<Document> delete(int docId) {
        return Optional.ofNullable(documents.remove(docId));
    }

    /**
     * 获取文档总数。
     */
    public int getTotalDocCount() {
        return documents.size();
    }

    /**
     * 返回升序 docId 快照。
     */
    public List<Integer> docIds() {
        return Collections.unmodifiableList(new ArrayList<>(documents.keySet()));
    }
}
