package com.nft.market.nft_market.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.nft.market.nft_market.service.SnapshotPersister;

@Configuration
public class AsyncConfig {

    /**
     * One thread, FIFO queue: snapshots and journal batches reach MongoDB in
     * the order the ledger committed them.
     */
    @Bean(name = SnapshotPersister.EXECUTOR)
    public ThreadPoolTaskExecutor snapshotExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("snapshot-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
