package com.retinaai.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pipeline infrastructure beans.
 * The scorer pool size is configurable via retina.scorer.pool-size.
 */
@Configuration
public class PipelineConfig {

    @Value("${retina.scorer.pool-size:4}")
    private int scorerPoolSize;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Threads that run scorer calls so the caller can bound them with a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scorerExecutor() {
        return Executors.newFixedThreadPool(scorerPoolSize, new CustomizableThreadFactory("scorer-"));
    }
}
