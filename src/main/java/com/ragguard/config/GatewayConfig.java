package com.ragguard.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.ragguard.service.PromptCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: clock, JSON, backend fan-out pool, prompt cache and S3 client
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Value("${gateway.fanout-threads:8}")
    private int fanoutThreads;

    @Value("${prompt-cache.ttl-minutes:60}")
    private long promptCacheTtlMinutes;

    @Value("${s3.region:us-east-1}")
    private String s3Region;

    @Value("${s3.endpoint:}")
    private String s3Endpoint;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Gson gson() {
        return new GsonBuilder().disableHtmlEscaping().create();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backendExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "backend-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(fanoutThreads, threadFactory);
    }

    @Bean
    public PromptCache promptCache(Clock clock) {
        log.info("Prompt cache TTL: {} minutes", promptCacheTtlMinutes);
        return new PromptCache(Duration.ofMinutes(promptCacheTtlMinutes), clock);
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(s3Region));
        if (s3Endpoint != null && !s3Endpoint.isBlank()) {
            builder.endpointOverride(URI.create(s3Endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }
}
