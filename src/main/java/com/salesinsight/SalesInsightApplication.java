package com.salesinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sales Insight Backend
 *
 * Ingests sales spreadsheets and serves analytics over the imported facts.
 *
 * Architecture:
 * - REST APIs for uploads, import status and analytics
 * - Scheduled dispatch + async processing of import jobs
 * - Row-by-row import with per-row failure isolation
 * - Redis result cache in front of every analytics query
 * - Fixed relational schema (schema.sql), validated at startup
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class SalesInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesInsightApplication.class, args);
    }
}
