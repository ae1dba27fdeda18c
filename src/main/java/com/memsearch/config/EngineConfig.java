package com.memsearch.config;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private int maxResultCount = Constants.MAX_RESULT_DOCUMENT_COUNT;
    private double relevanceEpsilon = Constants.RELEVANCE_EPSILON;
    private int parallelism = Constants.DEFAULT_PARALLELISM;

    public int getMaxResultCount() {
        return maxResultCount;
    }

    public void setMaxResultCount(int maxResultCount) {
        if (maxResultCount < 0) {
            throw new IllegalArgumentException("maxResultCount 不能为负数: " + maxResultCount);
        }
        this.maxResultCount = maxResultCount;
    }

    public double getRelevanceEpsilon() {
        return relevanceEpsilon;
    }

    public void setRelevanceEpsilon(double relevanceEpsilon) {
        if (relevanceEpsilon < 0 || Double.isNaN(relevanceEpsilon)) {
            throw new IllegalArgumentException("relevanceEpsilon 必须为非负数: " + relevanceEpsilon);
        }
        this.relevanceEpsilon = relevanceEpsilon;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism 必须为正数: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
