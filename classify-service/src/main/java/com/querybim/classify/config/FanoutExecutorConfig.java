package com.querybim.classify.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class FanoutExecutorConfig {

    /**
     * Runs the per-chunk embedding calls. Core and maximum size are the same, so up to
     * {@code poolSize} chunks are in flight before any chunk queues. When the pool and
     * queue are full the submitting thread runs the chunk itself, so a chunk is never dropped.
     */
    @Bean(name = "embeddingFanoutExecutor", destroyMethod = "shutdown")
    public ExecutorService embeddingFanoutExecutor(
            @Value("${classify.fanout.pool-size:16}") int poolSize,
            @Value("${classify.fanout.queue-capacity:256}") int queueCapacity,
            @Value("${classify.fanout.keep-alive-seconds:60}") long keepAliveSeconds
    ) {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "embed-fanout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };

        int size = Math.max(1, poolSize);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                size,
                size,
                Math.max(1L, keepAliveSeconds),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        // idle threads still exit, the pool only grows to poolSize under load
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
