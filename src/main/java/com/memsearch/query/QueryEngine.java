package com.memsearch.query;

import com.memsearch.config.EngineConfig;
import com.memsearch.document.Document;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.exec.ParallelExecutor;
import com.memsearch.index.IndexReader;
import com.memsearch.index.InvertedIndex;
import com.memsearch.index.UnknownDocumentException;
import com.memsearch.scoring.TfIdfScorer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TF-IDF 排序与文档匹配。
 *
 * 每次调用都在索引读锁下完成，工作线程只通过不加锁的只读视图访问索引。
 */
public class QueryEngine {
    private static final Comparator<SearchHit> BY_RELEVANCE = Comparator
            .comparingDouble(SearchHit::relevance).reversed()
            .thenComparingInt(SearchHit::docId);

    private static final Comparator<SearchHit> BY_RATING = Comparator
            .comparingInt(SearchHit::rating).reversed()
            .thenComparingInt(SearchHit::docId);

    private final InvertedIndex index;
    private final QueryParser parser;
    private final ParallelExecutor executor;
    private final int maxResultCount;
    private final double relevanceEpsilon;

    public QueryEngine(InvertedIndex index, QueryParser parser, ParallelExecutor executor, EngineConfig config) {
        this.index = index;
        this.parser = parser;
        this.executor = executor;
        this.maxResultCount = config.getMaxResultCount();
        this.relevanceEpsilon = config.getRelevanceEpsilon();
    }

    public List<SearchHit> findTopDocuments(ExecutionPolicy policy, String rawQuery, DocumentPredicate predicate) {
        return findTopDocuments(policy, parser.parse(rawQuery), predicate);
    }

    /**
     * 计算相关度、排序并截断到 maxResultCount。没有命中时返回空列表。
     */
    public List<SearchHit> findTopDocuments(ExecutionPolicy policy, ParsedQuery query, DocumentPredicate predicate) {
        return index.read(view -> topDocuments(policy, view, query, predicate));
    }

    /**
     * 批量查询：在同一读锁下按策略分发，每条查询在工作线程上顺序求值，
     * 第 i 个结果对应第 i 条查询。工作线程本身从不获取锁。
     */
    public List<List<SearchHit>> findTopDocumentsBatch(
            ExecutionPolicy policy,
            List<String> rawQueries,
            DocumentPredicate predicate) {
        return index.read(view -> executor.map(policy, rawQueries,
                rawQuery -> topDocuments(ExecutionPolicy.SEQUENTIAL, view, parser.parse(rawQuery), predicate)));
    }

    /**
     * 返回文档命中的加词；命中任一减词时返回空列表。
     *
     * @throws UnknownDocumentException 文档不存在
     */
    public MatchResult matchDocument(ExecutionPolicy policy, String rawQuery, int docId) {
        boolean sequential = policy == ExecutionPolicy.SEQUENTIAL;
        ParsedQuery query = parser.parse(rawQuery, sequential);

        return index.read(view -> {
            Document document = view.document(docId)
                    .orElseThrow(() -> new UnknownDocumentException(docId));

            if (executor.anyMatch(policy, query.minusWords(), word -> view.containsTerm(word, docId))) {
                return new MatchResult(List.of(), document.status());
            }

            List<String> matchedWords = executor.filter(policy, query.plusWords(),
                    word -> view.containsTerm(word, docId));
            if (!sequential) {
                matchedWords = matchedWords.stream().distinct().sorted().toList();
            }
            return new MatchResult(matchedWords, document.status());
        });
    }

    private List<SearchHit> topDocuments(
            ExecutionPolicy policy,
            IndexReader view,
            ParsedQuery query,
            DocumentPredicate predicate) {
        List<SearchHit> ranked = rank(findAllDocuments(policy, view, query, predicate), relevanceEpsilon);
        if (ranked.size() > maxResultCount) {
            return List.copyOf(ranked.subList(0, maxResultCount));
        }
        return List.copyOf(ranked);
    }

    private List<SearchHit> findAllDocuments(
            ExecutionPolicy policy,
            IndexReader view,
            ParsedQuery query,
            DocumentPredicate predicate) {
        TfIdfScorer scorer = new TfIdfScorer(view.documentCount());
        Map<Integer, Double> relevanceByDoc = policy == ExecutionPolicy.PARALLEL
                ? new ConcurrentHashMap<>()
                : new HashMap<>();

        executor.forEach(policy, query.plusWords(), word -> {
            Map<Integer, Double> postings = view.postings(word);
            if (postings.isEmpty()) {
                return;
            }
            double idf = view.inverseDocumentFrequency(word);
            for (Map.Entry<Integer, Double> posting : postings.entrySet()) {
                Document document = view.document(posting.getKey()).orElseThrow();
                if (predicate.test(document.docId(), document.status(), document.rating())) {
                    relevanceByDoc.merge(document.docId(), scorer.score(posting.getValue(), idf), Double::sum);
                }
            }
        });

        executor.forEach(policy, query.minusWords(), word -> {
            for (Integer docId : view.postings(word).keySet()) {
                relevanceByDoc.remove(docId);
            }
        });

        List<SearchHit> hits = new ArrayList<>(relevanceByDoc.size());
        for (Map.Entry<Integer, Double> entry : relevanceByDoc.entrySet()) {
            int rating = view.document(entry.getKey()).orElseThrow().rating();
            hits.add(new SearchHit(entry.getKey(), entry.getValue(), rating));
        }
        return hits;
    }

    /**
     * 按相关度降序排序；与组首相关度相差小于 epsilon 的连续结果视为并列，
     * 组内按评分降序。分组保证比较关系可传递。
     */
    static List<SearchHit> rank(List<SearchHit> hits, double epsilon) {
        List<SearchHit> sorted = new ArrayList<>(hits);
        sorted.sort(BY_RELEVANCE);

        int groupStart = 0;
        while (groupStart < sorted.size()) {
            double leaderRelevance = sorted.get(groupStart).relevance();
            int groupEnd = groupStart + 1;
            while (groupEnd < sorted.size()
                    && leaderRelevance - sorted.get(groupEnd).relevance() < epsilon) {
                groupEnd++;
            }
            if (groupEnd - groupStart > 1) {
                sorted.subList(groupStart, groupEnd).sort(BY_RATING);
            }
            groupStart = groupEnd;
        }
        return sorted;
    }
}
