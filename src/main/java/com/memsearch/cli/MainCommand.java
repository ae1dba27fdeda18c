package com.memsearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memsearch.SearchServer;
import com.memsearch.batch.QueryBatchProcessor;
import com.memsearch.config.Constants;
import com.memsearch.config.EngineConfig;
import com.memsearch.document.DocumentStatus;
import com.memsearch.exec.ExecutionPolicy;
import com.memsearch.query.MatchResult;
import com.memsearch.query.SearchHit;
import com.memsearch.text.StopWords;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "mse",
    description = "🔍 内存 TF-IDF 全文搜索引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.MatchSubcommand.class,
        MainCommand.DedupSubcommand.class,
        MainCommand.BatchSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--docs"}, description = "文档 JSON 文件（数组，字段 id/text/status/ratings）")
    private Path docsFile;

    @Option(names = {"--stop-words"}, description = "空格分隔的停用词", defaultValue = "")
    private String stopWords;

    @Option(names = {"--max-results"}, description = "单次查询最多返回的文档数", defaultValue = "5")
    private int maxResults;

    @Option(names = {"--epsilon"}, description = "相关度并列阈值", defaultValue = "1e-6")
    private double epsilon;

    @Option(names = {"--threads"}, description = "并行度，默认为 CPU 核数")
    private int threads = Constants.DEFAULT_PARALLELISM;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 内存 TF-IDF 全文搜索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private int resolveThreadCount() {
        if (threads <= 0) {
            System.err.printf("⚠️ 非法线程数 %d，已回退为默认值 %d%n", threads, Constants.DEFAULT_PARALLELISM);
            return Constants.DEFAULT_PARALLELISM;
        }
        if (threads > Constants.MAX_PARALLELISM) {
            System.err.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", threads, Constants.MAX_PARALLELISM);
            return Constants.MAX_PARALLELISM;
        }
        return threads;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        if (rawQuery.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return rawQuery;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setMaxResultCount(Math.max(maxResults, 0));
        config.setRelevanceEpsilon(epsilon);
        config.setParallelism(resolveThreadCount());
        return config;
    }

    /**
     * 创建服务并加载文档文件；未指定文件时返回空索引。
     */
    SearchServer openServer() throws IOException {
        SearchServer server = new SearchServer(StopWords.parse(stopWords), buildConfig());
        if (docsFile == null) {
            return server;
        }
        try {
            int added = new DocumentLoader().load(server, docsFile, System.err);
            System.out.println("📄 已加载文档: " + added);
            return server;
        } catch (IOException | RuntimeException exception) {
            server.close();
            throw exception;
        }
    }

    static String formatHit(SearchHit hit) {
        return "{ document_id = " + hit.docId()
            + ", relevance = " + hit.relevance()
            + ", rating = " + hit.rating() + " }";
    }

    static String formatMatch(int docId, MatchResult result) {
        StringBuilder builder = new StringBuilder();
        builder.append("{ document_id = ").append(docId)
            .append(", status = ").append(result.status())
            .append(", words =");
        for (String word : result.words()) {
            builder.append(' ').append(word);
        }
        return builder.append('}').toString();
    }

    @Command(name = "search", description = "🔎 执行 Top-K 查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "搜索查询语句", arity = "1")
        private String query;

        @Option(names = {"-s", "--status"}, description = "文档状态过滤", defaultValue = "ACTIVE")
        private DocumentStatus status;

        @Option(names = {"-p", "--policy"}, description = "执行策略 (SEQUENTIAL|PARALLEL)", defaultValue = "SEQUENTIAL")
        private ExecutionPolicy policy;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SearchServer server = main.openServer()) {
                String safeQuery = main.sanitizeQuery(query);
                long start = System.currentTimeMillis();
                List<SearchHit> hits = server.findTopDocuments(policy, safeQuery, status);
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(hits);
                } else {
                    printTextResult(hits);
                }
                System.out.println("📊 共 " + hits.size() + " 条结果，用时 " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(List<SearchHit> hits) {
            if (hits.isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            for (SearchHit hit : hits) {
                System.out.println(formatHit(hit));
            }
        }

        private void printJsonResult(List<SearchHit> hits) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(hits));
        }
    }

    @Command(name = "match", description = "🧩 对每个文档执行匹配")
    static class MatchSubcommand implements Callable<Integer> {

        @Parameters(description = "匹配查询语句", arity = "1")
        private String query;

        @Option(names = {"-p", "--policy"}, description = "执行策略 (SEQUENTIAL|PARALLEL)", defaultValue = "SEQUENTIAL")
        private ExecutionPolicy policy;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SearchServer server = main.openServer()) {
                String safeQuery = main.sanitizeQuery(query);
                System.out.println("🧩 匹配查询: \"" + safeQuery + "\"");
                long start = System.currentTimeMillis();
                for (int docId : server) {
                    System.out.println(formatMatch(docId, server.matchDocument(policy, safeQuery, docId)));
                }
                System.out.println("📊 用时 " + (System.currentTimeMillis() - start) + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 匹配失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "dedup", description = "🧹 删除词集合相同的重复文档")
    static class DedupSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SearchServer server = main.openServer()) {
                int before = server.getDocumentCount();
                List<Integer> removed = server.removeDuplicates();
                for (int docId : removed) {
                    System.out.println("Found duplicate document id " + docId);
                }
                System.out.println("✅ 删除前 " + before + " 个文档，删除后 " + server.getDocumentCount() + " 个");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 去重失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "batch", description = "📚 批量执行查询文件（每行一条）")
    static class BatchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询文件路径", arity = "1")
        private Path queriesFile;

        @Option(names = {"--joined"}, description = "按查询顺序拼接为单一结果序列")
        private boolean joined;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (SearchServer server = main.openServer()) {
                List<String> queries = Files.readAllLines(queriesFile);
                if (queries.size() > Constants.MAX_BATCH_SIZE) {
                    System.err.printf("⚠️ 查询数 %d 超过上限 %d，已截断%n", queries.size(), Constants.MAX_BATCH_SIZE);
                    queries = queries.subList(0, Constants.MAX_BATCH_SIZE);
                }
                queries = queries.stream().map(main::sanitizeQuery).toList();

                long start = System.currentTimeMillis();
                if (joined) {
                    for (SearchHit hit : QueryBatchProcessor.processQueriesJoined(server, queries)) {
                        System.out.println(formatHit(hit));
                    }
                } else {
                    List<List<SearchHit>> results = QueryBatchProcessor.processQueries(server, queries);
                    for (int index = 0; index < results.size(); index++) {
                        System.out.println(results.get(index).size() + " documents for query [" + queries.get(index) + "]");
                        for (SearchHit hit : results.get(index)) {
                            System.out.println("   " + formatHit(hit));
                        }
                    }
                }
                System.out.println("📊 " + queries.size() + " 条查询，用时 " + (System.currentTimeMillis() - start) + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 批量查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
