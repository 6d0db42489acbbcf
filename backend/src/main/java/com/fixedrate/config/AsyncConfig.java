package com.fixedrate.config;

import com.fixedrate.strategy.index.StrategyEventIndexer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for off-engine event consumers. Engine calls never run here.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String INDEXER_EXECUTOR = StrategyEventIndexer.INDEXER_EXECUTOR;

    /** Single thread keeps indexed events in publication order. */
    @Bean(name = INDEXER_EXECUTOR)
    public Executor indexerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("indexer-");
        e.initialize();
        return e;
    }
}
