package com.memsearch.index;

import com.memsearch.document.Document;
import com.memsearch.document.DocumentStatus;
import com.memsearch.document.DocumentTable;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.exec.ParallelExecutor;
import com.memsearch.scoring.TfIdfScorer;
import com.memsearch.text.InvalidWordException;
import com.memsearch.text.StopWords;
import com.memsearch.text.Tokenizer;
import com.memsearch.text.Words;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 内存倒排索引。
 *
 * 同时维护正排（docId → 词 → 频率）与倒排（词 → docId → 频率）两张表，
 * 只通过 insert / remove 两个入口同步修改。写操作持有写锁独占执行，
 * 查询在读锁下可并发。
 */
public final class InvertedIndex implements IndexReader {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    private final Tokenizer tokenizer;
    private final StopWords stopWords;
    private final ParallelExecutor executor;

    private final DocumentTable documentTable = new DocumentTable();
    private final Map<String, NavigableMap<Integer, Double>> termToDocumentFreqs = new HashMap<>();
    private final Map<Integer, NavigableMap<String, Double>> documentToTermFreqs = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final IndexReader unlockedView = new UnlockedView();

    public InvertedIndex(Tokenizer tokenizer, StopWords stopWords, ParallelExecutor executor) {
        this.tokenizer = tokenizer;
        this.stopWords = stopWords;
        this.executor = executor;
    }

    /**
     * 插入文档：先检查 ID，再校验全部词，之后一次性写入元数据、正排和倒排。
     *
     * @throws InvalidDocumentIdException docId 为负数或已存在
     * @throws InvalidWordException 文本中含控制字符
     */
    public void insert(int docId, String text, DocumentStatus status, List<Integer> ratings) {
        if (docId < 0) {
            throw new InvalidDocumentIdException(docId, "id must be non-negative");
        }
        Document document = Document.of(docId, text, status, ratings);
        List<String> words;

        lock.writeLock().lock();
        try {
            if (documentTable.contains(docId)) {
                throw new InvalidDocumentIdException(docId, "id is already indexed");
            }
            words = splitIntoWordsNoStop(document.text());
            documentTable.insert(document);
            NavigableMap<String, Double> termFreqs = new TreeMap<>();
            if (!words.isEmpty()) {
                double invWordCount = 1.0 / words.size();
                for (String word : words) {
                    termFreqs.merge(word, invWordCount, Double::sum);
                }
                for (Map.Entry<String, Double> entry : termFreqs.entrySet()) {
                    termToDocumentFreqs
                            .computeIfAbsent(entry.getKey(), ignored -> new TreeMap<>())
                            .put(docId, entry.getValue());
                }
            }
            documentToTermFreqs.put(docId, Collections.unmodifiableNavigableMap(termFreqs));
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("已索引文档 docId={}, 词数={}, 状态={}", docId, words.size(), status);
    }

    /**
     * 删除文档；docId 不存在时为空操作并返回 false。
     *
     * PARALLEL 策略下仅对各词倒排表的删除分发到工作线程，每个线程只触碰
     * 互不相交的倒排表；元数据与正排表只在调用线程上修改。
     */
    public boolean remove(ExecutionPolicy policy, int docId) {
        lock.writeLock().lock();
        try {
            if (!documentTable.contains(docId)) {
                return false;
            }
            List<String> terms = new ArrayList<>(documentToTermFreqs.get(docId).keySet());

            executor.forEach(policy, terms, term -> termToDocumentFreqs.get(term).remove(docId));

            for (String term : terms) {
                if (termToDocumentFreqs.get(term).isEmpty()) {
                    termToDocumentFreqs.remove(term);
                }
            }
            documentToTermFreqs.remove(docId);
            documentTable.delete(docId);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("已删除文档 docId={}, 策略={}", docId, policy);
        return true;
    }

    /**
     * 在读锁下对索引执行一组读取，保证读取期间索引不被修改。
     *
     * 传入的视图本身不加锁，可安全地交给工作线程使用，但不能在回调返回后继续使用。
     */
    public <T> T read(Function<IndexReader, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(unlockedView);
        } finally {
            lock.readLock().unlock();
        }
    }

    public StopWords getStopWords() {
        return stopWords;
    }

    @Override
    public int documentCount() {
        return read(IndexReader::documentCount);
    }

    @Override
    public List<Integer> documentIds() {
        return read(IndexReader::documentIds);
    }

    @Override
    public Optional<Document> document(int docId) {
        return read(view -> view.document(docId));
    }

    @Override
    public Map<String, Double> termFrequencies(int docId) {
        return read(view -> view.termFrequencies(docId));
    }

    @Override
    public Map<Integer, Double> postings(String term) {
        return read(view -> Map.copyOf(view.postings(term)));
    }

    @Override
    public boolean containsTerm(String term, int docId) {
        return read(view -> view.containsTerm(term, docId));
    }

    @Override
    public double inverseDocumentFrequency(String term) {
        return read(view -> view.inverseDocumentFrequency(term));
    }

    /**
     * 切分文本并去掉停用词，任一词非法则整篇拒绝。
     */
    private List<String> splitIntoWordsNoStop(String text) {
        List<String> words = new ArrayList<>();
        for (String word : tokenizer.split(text)) {
            if (!Words.isValidWord(word)) {
                throw new InvalidWordException(word);
            }
            if (!stopWords.isStopWord(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private final class UnlockedView implements IndexReader {

        @Override
        public int documentCount() {
            return documentTable.getTotalDocCount();
        }

        @Override
        public List<Integer> documentIds() {
            return documentTable.docIds();
        }

        @Override
        public Optional<Document> document(int docId) {
            return documentTable.findById(docId);
        }

        @Override
        public Map<String, Double> termFrequencies(int docId) {
            Map<String, Double> termFreqs = documentToTermFreqs.get(docId);
            return termFreqs == null ? Map.of() : termFreqs;
        }

        @Override
        public Map<Integer, Double> postings(String term) {
            NavigableMap<Integer, Double> docFreqs = termToDocumentFreqs.get(term);
            return docFreqs == null ? Map.of() : Collections.unmodifiableMap(docFreqs);
        }

        @Override
        public boolean containsTerm(String term, int docId) {
            Map<Integer, Double> docFreqs = termToDocumentFreqs.get(term);
            return docFreqs != null && docFreqs.containsKey(docId);
        }

        @Override
        public double inverseDocumentFrequency(String term) {
            Map<Integer, Double> docFreqs = termToDocumentFreqs.get(term);
            if (docFreqs == null || docFreqs.isEmpty()) {
                throw new UnknownTermException(term);
            }
            return new TfIdfScorer(documentTable.getTotalDocCount()).computeIDF(docFreqs.size());
        }
    }
}
