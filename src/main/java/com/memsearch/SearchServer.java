package com.memsearch;

import com.memsearch.config.EngineConfig;
import com.memsearch.dedup.DuplicateDetector;
import com.memsearch.document.Document;
import com.memsearch.document.DocumentStatus;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.exec.ParallelExecutor;
import com.memsearch.index.InvertedIndex;
import com.memsearch.query.DocumentPredicate;
import com.memsearch.query.MatchResult;
import com.memsearch.query.QueryEngine;
import com.memsearch.query.QueryParser;
import com.memsearch.query.SearchHit;
import com.memsearch.text.SpaceTokenizer;
import com.memsearch.text.StopWords;
import com.memsearch.text.Tokenizer;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内存搜索服务入口。
 *
 * 组合分词、停用词、倒排索引与排序引擎；持有并行执行所需的工作线程池，
 * 使用完毕后需要关闭。
 */
public class SearchServer implements Iterable<Integer>, AutoCloseable {
    private final EngineConfig config;
    private final ParallelExecutor executor;
    private final InvertedIndex index;
    private final QueryEngine queryEngine;

    public SearchServer(String stopWordsText) {
        this(StopWords.parse(stopWordsText), EngineConfig.defaults());
    }

    public SearchServer(Collection<String> stopWords) {
        this(StopWords.of(stopWords), EngineConfig.defaults());
    }

    public SearchServer(StopWords stopWords, EngineConfig config) {
        this.config = config;
        this.executor = new ParallelExecutor(config.getParallelism());
        Tokenizer tokenizer = new SpaceTokenizer();
        this.index = new InvertedIndex(tokenizer, stopWords, executor);
        this.queryEngine = new QueryEngine(index, new QueryParser(tokenizer, stopWords), executor, config);
    }

    /**
     * 添加文档。
     *
     * @throws com.memsearch.index.InvalidDocumentIdException docId 为负数或已存在
     * @throws com.memsearch.text.InvalidWordException 文本中含控制字符
     */
    public void addDocument(int docId, String text, DocumentStatus status, List<Integer> ratings) {
        index.insert(docId, text, status, ratings);
    }

    public List<SearchHit> findTopDocuments(String rawQuery) {
        return findTopDocuments(ExecutionPolicy.SEQUENTIAL, rawQuery);
    }

    public List<SearchHit> findTopDocuments(String rawQuery, DocumentStatus status) {
        return findTopDocuments(ExecutionPolicy.SEQUENTIAL, rawQuery, status);
    }

    public List<SearchHit> findTopDocuments(String rawQuery, DocumentPredicate predicate) {
        return findTopDocuments(ExecutionPolicy.SEQUENTIAL, rawQuery, predicate);
    }

    public List<SearchHit> findTopDocuments(ExecutionPolicy policy, String rawQuery) {
        return findTopDocuments(policy, rawQuery, DocumentPredicate.active());
    }

    public List<SearchHit> findTopDocuments(ExecutionPolicy policy, String rawQuery, DocumentStatus status) {
        return findTopDocuments(policy, rawQuery, DocumentPredicate.withStatus(status));
    }

    public List<SearchHit> findTopDocuments(ExecutionPolicy policy, String rawQuery, DocumentPredicate predicate) {
        return queryEngine.findTopDocuments(policy, rawQuery, predicate);
    }

    /**
     * 对每条查询执行默认（ACTIVE）状态的 Top-K 检索，结果顺序与输入一致。
     */
    public List<List<SearchHit>> findTopDocumentsBatch(ExecutionPolicy policy, List<String> rawQueries) {
        return queryEngine.findTopDocumentsBatch(policy, rawQueries, DocumentPredicate.active());
    }

    public MatchResult matchDocument(String rawQuery, int docId) {
        return matchDocument(ExecutionPolicy.SEQUENTIAL, rawQuery, docId);
    }

    /**
     * @throws com.memsearch.index.UnknownDocumentException 文档不存在
     */
    public MatchResult matchDocument(ExecutionPolicy policy, String rawQuery, int docId) {
        return queryEngine.matchDocument(policy, rawQuery, docId);
    }

    public void removeDocument(int docId) {
        removeDocument(ExecutionPolicy.SEQUENTIAL, docId);
    }

    /**
     * 删除文档，docId 不存在时什么也不做。
     */
    public void removeDocument(ExecutionPolicy policy, int docId) {
        index.remove(policy, docId);
    }

    /**
     * 删除重复文档并返回被删除的 ID。
     */
    public List<Integer> removeDuplicates() {
        return new DuplicateDetector().removeDuplicates(this);
    }

    public int getDocumentCount() {
        return index.documentCount();
    }

    /**
     * 升序文档 ID 快照。
     */
    public List<Integer> documentIds() {
        return index.documentIds();
    }

    @Override
    public Iterator<Integer> iterator() {
        return documentIds().iterator();
    }

    /**
     * 文档的词频表，按词升序；文档不存在时返回空表。
     */
    public Map<String, Double> getWordFrequencies(int docId) {
        return index.termFrequencies(docId);
    }

    public Optional<Document> findDocument(int docId) {
        return index.document(docId);
    }

    public StopWords getStopWords() {
        return index.getStopWords();
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        executor.close();
    }
}
