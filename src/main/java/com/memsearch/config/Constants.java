package com.memsearch.config;

/**
 * 全局常量定义
 * 
 * 包含排序参数、并发参数和命令行输入上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 排序参数 ====================
    /** 单次查询返回的最大文档数 */
    public static final int MAX_RESULT_DOCUMENT_COUNT = 5;
    /** 相关度差值小于该阈值时视为并列，按评分排序 */
    public static final double RELEVANCE_EPSILON = 1e-6;

    // ==================== 线程参数 ====================
    /** 默认并行度 */
    public static final int DEFAULT_PARALLELISM = Runtime.getRuntime().availableProcessors();
    /** 并行度安全上限 */
    public static final int MAX_PARALLELISM = 64;

    // ==================== 命令行参数 ====================
    /** 单条查询最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
    /** 批量查询条数上限 */
    public static final int MAX_BATCH_SIZE = 10_000;
}
