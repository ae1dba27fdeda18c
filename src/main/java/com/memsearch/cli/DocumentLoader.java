package com.memsearch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memsearch.SearchServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * 从 JSON 数组文件读取文档并逐条加入索引，单条失败只报告不中断。
 */
public class DocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<DocumentSource> read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), new TypeReference<List<DocumentSource>>() {
        });
    }

    /**
     * 加载文件中的全部文档，返回成功加入的数量。
     */
    public int load(SearchServer server, Path file, PrintStream err) throws IOException {
        int added = 0;
        for (DocumentSource source : read(file)) {
            try {
                server.addDocument(source.id(), source.text(), source.status(), source.ratings());
                added++;
            } catch (IllegalArgumentException exception) {
                logger.warn("文档 {} 被拒绝: {}", source.id(), exception.getMessage());
                err.println("❌ 文档 " + source.id() + " 添加失败: " + exception.getMessage());
            }
        }
        return added;
    }
}
