package com.annograph.aggregate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for aggregate rebuilds, separate from request threads. A full queue rejects the
 * task instead of running it on the caller.
 */
@Configuration
public class AggregateExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(AggregateExecutorConfig.class);

    @Bean(name = {"aggregateRefreshExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor aggregateRefreshExecutor(
            @Value("${annograph.aggregate.executor.threads:2}") int threads,
            @Value("${annograph.aggregate.executor.queue-capacity:16}") int queueCapacity) {
        int core = Math.max(1, threads);
        int queue = Math.max(1, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, core, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory("aggregate-refresh-"),
                new LoggingRejectionHandler());
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool 'aggregate-refresh-' initialized: threads={}, queue={}", core, queue);
        return executor;
    }

    static final class LoggingRejectionHandler implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("aggregate refresh rejected: active={}, queued={}", executor.getActiveCount(), executor.getQueue().size());
            throw new RejectedExecutionException("aggregate refresh pool saturated");
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
