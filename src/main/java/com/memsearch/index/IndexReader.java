package com.memsearch.index;

import com.memsearch.document.Document;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 倒排索引的只读视图。
 */
public interface IndexReader {

    int documentCount();

    /**
     * 升序、去重的文档 ID。
     */
    List<Integer> documentIds();

    Optional<Document> document(int docId);

    /**
     * 文档的词频表（词 → 频率），文档不存在时返回空表。
     */
    Map<String, Double> termFrequencies(int docId);

    /**
     * 词的倒排表（docId → 频率），词不存在时返回空表。
     */
    Map<Integer, Double> postings(String term);

    /**
     * 判断文档是否包含该词。
     */
    boolean containsTerm(String term, int docId);

    /**
     * ln(文档总数 / 包含该词的文档数)。
     *
     * @throws UnknownTermException 该词没有任何倒排记录
     */
    double inverseDocumentFrequency(String term);
}
