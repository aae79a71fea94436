package com.flagship.member_payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fixed pool that renders documents, sized by documents.worker.threads.
 */
@Configuration
public class GenerationExecutorConfig {

    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor(@Value("${documents.worker.threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("document-gen-"));
    }
}
