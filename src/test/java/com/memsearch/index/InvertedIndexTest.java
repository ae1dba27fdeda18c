package com.memsearch.index;

import com.memsearch.document.DocumentStatus;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.exec.ParallelExecutor;
import com.memsearch.text.InvalidWordException;
import com.memsearch.text.SpaceTokenizer;
import com.memsearch.text.StopWords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvertedIndexTest {

    private ParallelExecutor executor;
    private InvertedIndex index;

    @BeforeEach
    void setUp() {
        executor = new ParallelExecutor(4);
        index = new InvertedIndex(new SpaceTokenizer(), StopWords.parse("and in with"), executor);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("词频为出现次数除以非停用词总数")
    void testTermFrequencies() {
        index.insert(1, "funny pet and funny rat", DocumentStatus.ACTIVE, List.of(4));

        Map<String, Double> frequencies = index.termFrequencies(1);

        assertEquals(List.of("funny", "pet", "rat"), List.copyOf(frequencies.keySet()));
        assertEquals(0.5, frequencies.get("funny"), 1e-12);
        assertEquals(0.25, frequencies.get("pet"), 1e-12);
        assertEquals(1.0, frequencies.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    @DisplayName("正排与倒排同步写入")
    void testPostingsMirrorForwardIndex() {
        index.insert(1, "white cat", DocumentStatus.ACTIVE, List.of());
        index.insert(2, "black cat", DocumentStatus.BANNED, List.of());

        assertEquals(Map.of(1, 0.5, 2, 0.5), index.postings("cat"));
        assertEquals(Map.of(1, 0.5), index.postings("white"));
        assertTrue(index.containsTerm("black", 2));
        assertFalse(index.containsTerm("black", 1));
        assertEquals(List.of(1, 2), index.documentIds());
        assertEquals(DocumentStatus.BANNED, index.document(2).orElseThrow().status());
    }

    @Test
    @DisplayName("负数或重复 ID 被拒绝且索引不变")
    void testInvalidDocumentId() {
        index.insert(1, "white cat", DocumentStatus.ACTIVE, List.of(1));

        InvalidDocumentIdException duplicate = assertThrows(InvalidDocumentIdException.class,
                () -> index.insert(1, "black dog", DocumentStatus.ACTIVE, List.of(2)));
        assertEquals(1, duplicate.getDocId());
        assertThrows(InvalidDocumentIdException.class,
                () -> index.insert(-1, "black dog", DocumentStatus.ACTIVE, List.of()));
        assertThrows(InvalidDocumentIdException.class,
                () -> index.insert(1, "bad\u0001word", DocumentStatus.ACTIVE, List.of()));
        assertThrows(InvalidDocumentIdException.class,
                () -> index.insert(-2, "bad\u0001word", DocumentStatus.ACTIVE, List.of()));

        assertEquals(1, index.documentCount());
        assertEquals("white cat", index.document(1).orElseThrow().text());
        assertTrue(index.postings("dog").isEmpty());
    }

    @Test
    @DisplayName("含控制字符的文档整篇拒绝")
    void testInvalidWordRejected() {
        assertThrows(InvalidWordException.class,
                () -> index.insert(3, "good ba\u0001d word", DocumentStatus.ACTIVE, List.of()));

        assertEquals(0, index.documentCount());
        assertTrue(index.postings("good").isEmpty());
        assertFalse(index.document(3).isPresent());
    }

    @Test
    @DisplayName("空文档与全停用词文档可插入和删除")
    void testEmptyDocuments() {
        index.insert(5, "", DocumentStatus.ACTIVE, List.of(1, 2));
        index.insert(6, "and with in", DocumentStatus.ACTIVE, List.of());

        assertEquals(2, index.documentCount());
        assertTrue(index.termFrequencies(5).isEmpty());
        assertTrue(index.termFrequencies(6).isEmpty());

        assertTrue(index.remove(ExecutionPolicy.SEQUENTIAL, 5));
        assertTrue(index.remove(ExecutionPolicy.PARALLEL, 6));
        assertEquals(0, index.documentCount());
    }

    @Test
    @DisplayName("IDF 随文档集合变化，无倒排的词报错")
    void testInverseDocumentFrequency() {
        index.insert(1, "cat dog", DocumentStatus.ACTIVE, List.of());
        index.insert(2, "cat", DocumentStatus.ACTIVE, List.of());

        assertEquals(Math.log(2), index.inverseDocumentFrequency("dog"), 1e-12);
        assertEquals(0.0, index.inverseDocumentFrequency("cat"), 1e-12);

        index.remove(ExecutionPolicy.SEQUENTIAL, 1);

        UnknownTermException exception = assertThrows(UnknownTermException.class,
                () -> index.inverseDocumentFrequency("dog"));
        assertEquals("dog", exception.getTerm());
    }

    @ParameterizedTest
    @EnumSource(ExecutionPolicy.class)
    @DisplayName("插入后删除恢复原状态")
    void testInsertRemoveRoundTrip(ExecutionPolicy policy) {
        index.insert(1, "white cat and fancy collar", DocumentStatus.ACTIVE, List.of(8, -3));
        Map<Integer, Double> catPostings = index.postings("cat");
        List<Integer> idsBefore = index.documentIds();

        index.insert(2, "fluffy cat fluffy tail", DocumentStatus.ACTIVE, List.of(7, 2, 7));
        assertTrue(index.remove(policy, 2));

        assertEquals(idsBefore, index.documentIds());
        assertEquals(catPostings, index.postings("cat"));
        assertTrue(index.postings("fluffy").isEmpty());
        assertTrue(index.termFrequencies(2).isEmpty());
        assertFalse(index.remove(policy, 2));
    }

    @Test
    @DisplayName("并行删除与顺序删除结果一致")
    void testParallelRemoveMatchesSequential() {
        InvertedIndex other = new InvertedIndex(new SpaceTokenizer(), StopWords.parse("and in with"), executor);
        String[] texts = {
            "funny pet and nasty rat",
            "funny pet with curly hair",
            "nasty rat with curly hair",
            "pet with rat and rat and rat"
        };
        for (int docId = 0; docId < texts.length; docId++) {
            index.insert(docId, texts[docId], DocumentStatus.ACTIVE, List.of(docId));
            other.insert(docId, texts[docId], DocumentStatus.ACTIVE, List.of(docId));
        }

        index.remove(ExecutionPolicy.SEQUENTIAL, 2);
        other.remove(ExecutionPolicy.PARALLEL, 2);

        assertEquals(index.documentIds(), other.documentIds());
        for (String term : List.of("funny", "pet", "nasty", "rat", "curly", "hair")) {
            assertEquals(index.postings(term), other.postings(term), term);
        }
    }
}
