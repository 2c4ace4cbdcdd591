package com.supportdesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 * <p>
 * 部门分类器（LLM 调用）在独立线程池中执行，调用方按超时等待，
 * 超时或被拒绝时路由降级为关键字规则，不阻塞工单写路径。
 * </p>
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * 分类器专用线程池，默认 AbortPolicy：队列满时直接拒绝，由路由服务降级处理。
     */
    @Bean(name = "classifierExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "classifierExecutor")
    public ThreadPoolExecutor classifierExecutor(
            @Value("${executor.classifier.core-size:4}") int coreSize,
            @Value("${executor.classifier.max-size:8}") int maxSize,
            @Value("${executor.classifier.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.classifier.queue-capacity:200}") int queueCapacity,
            @Value("${executor.classifier.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.classifier.thread-name-prefix:classifier-worker-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }
}
