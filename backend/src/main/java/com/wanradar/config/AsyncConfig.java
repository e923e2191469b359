package com.wanradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. refresh-executor runs the long-lived refresh worker loops, one thread per telemetry category.
 */
@Configuration
public class AsyncConfig {

    public static final String REFRESH_EXECUTOR = "refresh-executor";

    /** Port stats and device stats. */
    static final int REFRESH_WORKERS = 2;

    /** No queue: a worker loop either gets its own thread or is rejected. */
    @Bean(name = REFRESH_EXECUTOR)
    public Executor refreshExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(REFRESH_WORKERS);
        e.setMaxPoolSize(REFRESH_WORKERS);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("refresh-");
        e.initialize();
        return e;
    }
}
