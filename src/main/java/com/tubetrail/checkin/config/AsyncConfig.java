package com.tubetrail.checkin.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for photo reads, plus the server clock.
 *
 * OcrService hands each vision call to this pool and waits with a hard
 * timeout, so a slow upstream can never hold a check-in request open
 * indefinitely.
 * - Core: 4 threads, Max: 16 threads, Queue: 100 tasks
 * - AbortPolicy: a saturated pool rejects immediately; the rejection is
 *   treated as an unavailable reader (ocr_failed), not as a hang.
 */
@Configuration
public class AsyncConfig {

    @Bean("ocrTaskExecutor")
    public Executor ocrTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ocr-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /** visited_at and audit timestamps come from here, never from the request */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
