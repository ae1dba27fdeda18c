package com.memsearch.batch;

import com.memsearch.SearchServer;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.query.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量查询：每条查询独立执行，结果按输入顺序写回。
 */
public final class QueryBatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(QueryBatchProcessor.class);

    private QueryBatchProcessor() {
    }

    /**
     * 并行执行全部查询，第 i 个结果列表对应第 i 条查询。
     */
    public static List<List<SearchHit>> processQueries(SearchServer server, List<String> queries) {
        return processQueries(ExecutionPolicy.PARALLEL, server, queries);
    }

    public static List<List<SearchHit>> processQueries(ExecutionPolicy policy, SearchServer server, List<String> queries) {
        logger.debug("批量查询 {} 条，策略={}", queries.size(), policy);
        return server.findTopDocumentsBatch(policy, queries);
    }

    /**
     * 按查询顺序拼接各查询结果，不做跨查询重排。
     */
    public static List<SearchHit> processQueriesJoined(SearchServer server, List<String> queries) {
        List<SearchHit> joined = new ArrayList<>();
        for (List<SearchHit> hits : processQueries(server, queries)) {
            joined.addAll(hits);
        }
        return joined;
    }
}
