package com.memsearch.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * 按执行策略运行集合操作的基础原语。
 *
 * PARALLEL 策略下任务提交到私有 ForkJoinPool，调用线程阻塞直至完成；
 * 任一工作线程抛出的异常只在调用线程上重新抛出一次。
 */
public final class ParallelExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ParallelExecutor.class);

    private final ForkJoinPool pool;

    public ParallelExecutor(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism 必须为正数: " + parallelism);
        }
        this.pool = new ForkJoinPool(parallelism);
    }

    public int getParallelism() {
        return pool.getParallelism();
    }

    /**
     * 对每个元素执行动作。
     */
    public <T> void forEach(ExecutionPolicy policy, Collection<T> items, Consumer<? super T> action) {
        run(policy, () -> {
            stream(policy, items).forEach(action);
            return null;
        });
    }

    /**
     * 任一元素满足条件即返回 true；并行时命中后其它探测可能仍在进行。
     */
    public <T> boolean anyMatch(ExecutionPolicy policy, Collection<T> items, Predicate<? super T> predicate) {
        if (items.isEmpty()) {
            return false;
        }
        return run(policy, () -> stream(policy, items).anyMatch(predicate));
    }

    /**
     * 过滤元素，结果顺序与输入顺序一致。
     */
    public <T> List<T> filter(ExecutionPolicy policy, Collection<T> items, Predicate<? super T> predicate) {
        if (items.isEmpty()) {
            return List.of();
        }
        return run(policy, () -> stream(policy, items).filter(predicate).toList());
    }

    /**
     * 逐个映射元素，输出第 i 个槽位对应输入第 i 个元素。
     */
    public <T, R> List<R> map(ExecutionPolicy policy, List<T> items, Function<? super T, ? extends R> mapper) {
        if (items.isEmpty()) {
            return List.of();
        }
        return run(policy, () -> stream(policy, items).<R>map(mapper).toList());
    }

    /**
     * 在当前策略对应的线程上执行任意计算。
     */
    public <R> R run(ExecutionPolicy policy, Supplier<R> computation) {
        if (policy == ExecutionPolicy.SEQUENTIAL || ForkJoinTask.inForkJoinPool()) {
            return computation.get();
        }
        return pool.submit(computation::get).join();
    }

    private <T> Stream<T> stream(ExecutionPolicy policy, Collection<T> items) {
        return policy == ExecutionPolicy.PARALLEL ? items.parallelStream() : items.stream();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("工作线程池未能在超时内关闭，强制终止");
                pool.shutdownNow();
            }
        } catch (InterruptedException interruptedException) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
