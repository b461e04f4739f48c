package com.meterpay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: monitor-executor runs confirmation polls handed out by the monitor tick.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String MONITOR_EXECUTOR = "monitor-executor";

    /** Fixed pool with a bounded queue; a rejected poll is retried on the next tick. */
    @Bean(name = MONITOR_EXECUTOR)
    public Executor monitorExecutor(@Value("${meterpay.monitor.workers:4}") int workers) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("monitor-");
        e.initialize();
        return e;
    }
}
