package com.example.canonical.ingestion.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
public class IngestionExecutorConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        log.info("Creating single-thread pipeline executor");
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("pipeline-"));
    }

    /**
     * Cached pool so a gate abandoned after its timeout does not block the next check.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService integrityGateExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("integrity-gate-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
}
