package com.example.redline.config;

import com.example.redline.application.StatuteSource;
import com.example.redline.infrastructure.fetch.EcfrStatuteSource;
import com.example.redline.infrastructure.fetch.GovInfoStatuteSource;
import com.example.redline.infrastructure.fetch.RetryingStatuteSource;
import com.example.redline.infrastructure.fetch.RoutingStatuteSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RedlineConfiguration {
    private static final Logger log = LogManager.getLogger(RedlineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "statuteFetchExecutor", destroyMethod = "shutdown")
    public ExecutorService statuteFetchExecutor(
            @Value("${redline.fetch.thread-pool-size:0}") int threadPoolSize) {
        int poolSize = Math.max(1, threadPoolSize > 0 ? threadPoolSize : Runtime.getRuntime().availableProcessors());
        log.info("Statute fetch pool size: {}", poolSize);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads =
                runnable -> {
                    Thread thread = new Thread(runnable, "statute-fetch-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newFixedThreadPool(poolSize, threads);
    }

    @Bean
    public RestClientCustomizer statuteClientTimeouts(
            @Value("${redline.fetch.connect-timeout:10s}") Duration connectTimeout,
            @Value("${redline.fetch.read-timeout:30s}") Duration readTimeout) {
        return builder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }

    @Bean
    @Primary
    public StatuteSource statuteSource(
            GovInfoStatuteSource govInfo,
            EcfrStatuteSource ecfr,
            @Value("${redline.fetch.max-attempts:3}") int maxAttempts,
            @Value("${redline.fetch.initial-backoff:500ms}") Duration initialBackoff,
            @Value("${redline.fetch.max-backoff:30s}") Duration maxBackoff) {
        return new RetryingStatuteSource(
                new RoutingStatuteSource(govInfo, ecfr), maxAttempts, initialBackoff, maxBackoff);
    }
}
