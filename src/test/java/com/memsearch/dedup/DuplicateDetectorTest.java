package com.memsearch.dedup;

import com.memsearch.SearchServer;
import com.memsearch.document.DocumentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuplicateDetectorTest {

    private static SearchServer createServer() {
        SearchServer server = new SearchServer("and with");
        server.addDocument(1, "funny pet and nasty rat", DocumentStatus.ACTIVE, List.of(7, 2, 7));
        server.addDocument(2, "funny pet with curly hair", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(3, "funny pet with curly hair", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(4, "funny pet and curly hair", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(5, "funny funny pet and nasty nasty rat", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(6, "funny pet and not very nasty rat", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(7, "very nasty rat and not very funny pet", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(8, "pet with rat and rat and rat", DocumentStatus.ACTIVE, List.of(1, 2));
        server.addDocument(9, "nasty rat with curly hair", DocumentStatus.ACTIVE, List.of(1, 2));
        return server;
    }

    @Test
    @DisplayName("词集合相同的文档只保留 ID 最小者")
    void testRemoveDuplicates() {
        try (SearchServer server = createServer()) {
            List<Integer> removed = server.removeDuplicates();

            assertEquals(List.of(3, 4, 5, 7), removed);
            assertEquals(List.of(1, 2, 6, 8, 9), server.documentIds());
        }
    }

    @Test
    @DisplayName("仅查找时不修改索引")
    void testFindDuplicatesReadOnly() {
        try (SearchServer server = createServer()) {
            List<Integer> duplicates = new DuplicateDetector().findDuplicates(server);

            assertEquals(List.of(3, 4, 5, 7), duplicates);
            assertEquals(9, server.getDocumentCount());
        }
    }

    @Test
    @DisplayName("空文档之间互为重复")
    void testEmptyDocumentsAreDuplicates() {
        try (SearchServer server = new SearchServer("and")) {
            server.addDocument(4, "", DocumentStatus.ACTIVE, List.of());
            server.addDocument(2, "and", DocumentStatus.ACTIVE, List.of());
            server.addDocument(9, "cat", DocumentStatus.ACTIVE, List.of());

            assertEquals(List.of(4), server.removeDuplicates());
            assertEquals(List.of(2, 9), server.documentIds());
            assertTrue(server.removeDuplicates().isEmpty());
        }
    }
}
