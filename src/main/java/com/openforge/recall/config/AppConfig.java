package com.openforge.recall.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.recall.store.StoreProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Core infrastructure beans:
 *  - store executor  → runs the physical store call so a timed-out attempt can be cancelled
 *  - Java HttpClient → the only HTTP engine (embedding endpoint)
 *  - Jackson         → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock           → the one time source for recency
 */
@Configuration
public class AppConfig {

    /**
     * Bounded pool for vector store calls. A full queue rejects the submit,
     * which the resilient layer counts as a failed attempt.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService storeExecutor(StoreProperties storeProperties) {
        int threads = storeProperties.executorThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads,
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 16),
                new CustomizableThreadFactory("recall-store-"),
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Single, shared HttpClient instance; per-request read timeouts are set at
     * the call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (prompt_tokens, …)
     *  - ISO-8601 dates, NOT timestamps
     *  - unknown properties ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
