package com.ragguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RagGuard - access-controlled retrieval gateway
 *
 * Answers natural-language queries from a vector knowledge base and a Solr index,
 * returning only documents the caller is authorized to see.
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class RagGuardApplication {

    public static void main(String[] args) {
        log.info("Starting RagGuard retrieval gateway");
        SpringApplication.run(RagGuardApplication.class, args);
        log.info("RagGuard started successfully");
    }
}
