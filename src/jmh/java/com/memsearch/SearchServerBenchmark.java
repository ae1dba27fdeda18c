package com.memsearch;

import com.memsearch.batch.QueryBatchProcessor;
import com.memsearch.document.DocumentStatus;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.query.MatchResult;
import com.memsearch.query.SearchHit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 检索、匹配与删除的顺序/并行对比基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SearchServerBenchmark {

    private static final int DOCUMENT_COUNT = 10_000;
    private static final int DICTIONARY_SIZE = 2_000;

    static List<String> generateDictionary(Random random, int size, int maxLength) {
        List<String> words = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int length = 1 + random.nextInt(maxLength);
            StringBuilder word = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                word.append((char) ('a' + random.nextInt(26)));
            }
            words.add(word.toString());
        }
        return words;
    }

    static String generateQuery(Random random, List<String> dictionary, int wordCount, double minusProbability) {
        StringBuilder query = new StringBuilder();
        for (int i = 0; i < wordCount; i++) {
            if (i > 0) {
                query.append(' ');
            }
            if (random.nextDouble() < minusProbability) {
                query.append('-');
            }
            query.append(dictionary.get(random.nextInt(dictionary.size())));
        }
        return query.toString();
    }

    @State(Scope.Benchmark)
    public static class ServerState {
        SearchServer server;
        List<String> queries;
        String matchQuery;

        @Setup
        public void setup() {
            Random random = new Random(7);
            List<String> dictionary = generateDictionary(random, DICTIONARY_SIZE, 10);
            server = new SearchServer(String.join(" ", dictionary.subList(0, 20)));
            for (int i = 0; i < DOCUMENT_COUNT; i++) {
                server.addDocument(i, generateQuery(random, dictionary, 70, 0.0),
                    DocumentStatus.ACTIVE, List.of(1, 2, 3));
            }
            queries = new ArrayList<>();
            for (int i = 0; i < 2_000; i++) {
                queries.add(generateQuery(random, dictionary, 7, 0.1));
            }
            matchQuery = generateQuery(random, dictionary, 500, 0.1);
        }

        @TearDown
        public void tearDown() {
            server.close();
        }
    }

    @State(Scope.Thread)
    public static class RemovalState {
        SearchServer server;

        @Setup(Level.Invocation)
        public void setup() {
            Random random = new Random(11);
            List<String> dictionary = generateDictionary(random, DICTIONARY_SIZE, 10);
            server = new SearchServer("");
            for (int i = 0; i < 1_000; i++) {
                server.addDocument(i, generateQuery(random, dictionary, 100, 0.0),
                    DocumentStatus.ACTIVE, List.of(1));
            }
        }

        @TearDown(Level.Invocation)
        public void tearDown() {
            server.close();
        }
    }

    @Benchmark
    public List<SearchHit> findTopSequential(ServerState state) {
        return state.server.findTopDocuments(ExecutionPolicy.SEQUENTIAL, state.queries.get(0));
    }

    @Benchmark
    public List<SearchHit> findTopParallel(ServerState state) {
        return state.server.findTopDocuments(ExecutionPolicy.PARALLEL, state.queries.get(0));
    }

    @Benchmark
    public MatchResult matchSequential(ServerState state) {
        return state.server.matchDocument(ExecutionPolicy.SEQUENTIAL, state.matchQuery, 42);
    }

    @Benchmark
    public MatchResult matchParallel(ServerState state) {
        return state.server.matchDocument(ExecutionPolicy.PARALLEL, state.matchQuery, 42);
    }

    @Benchmark
    public List<SearchHit> processQueriesJoined(ServerState state) {
        return QueryBatchProcessor.processQueriesJoined(state.server, state.queries);
    }

    @Benchmark
    public int removeSequential(RemovalState state) {
        for (int i = 0; i < 1_000; i++) {
            state.server.removeDocument(ExecutionPolicy.SEQUENTIAL, i);
        }
        return state.server.getDocumentCount();
    }

    @Benchmark
    public int removeParallel(RemovalState state) {
        for (int i = 0; i < 1_000; i++) {
            state.server.removeDocument(ExecutionPolicy.PARALLEL, i);
        }
        return state.server.getDocumentCount();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(SearchServerBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
