package com.memsearch.exec;

/** 调用方显式选择的执行策略 */
public enum ExecutionPolicy {
    /** 在调用线程上顺序执行 */
    SEQUENTIAL,
    /** 分发到工作线程池并阻塞等待全部完成 */
    PARALLEL
}
