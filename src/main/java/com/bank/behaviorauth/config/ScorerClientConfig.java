package com.bank.behaviorauth.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads and HTTP client for signal scoring. Model calls and in-process
 * signals run on separate bounded pools, so a hanging model cannot queue
 * similarity and drift behind it. A full pool rejects instead of queueing.
 */
@Configuration
public class ScorerClientConfig {

    @Bean(name = "scorerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scorerExecutor(AuthEngineProperties properties) {
        AuthEngineProperties.Scorers scorers = properties.getScorers();
        return boundedPool("model-scorer-", scorers.getExecutorThreads(), scorers.getQueueCapacity());
    }

    @Bean(name = "localSignalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService localSignalExecutor(AuthEngineProperties properties) {
        AuthEngineProperties.Scorers scorers = properties.getScorers();
        return boundedPool("local-signal-", scorers.getLocalThreads(), scorers.getLocalQueueCapacity());
    }

    @Bean
    @Qualifier("modelRestTemplate")
    public RestTemplate modelRestTemplate(RestTemplateBuilder builder, AuthEngineProperties properties) {
        // Socket timeouts are a backstop for calls that ignore interruption; the gateway enforces the budget
        Duration backstop = Duration.ofMillis(Math.max(100, properties.getLimits().getScorerTimeoutMs() * 3));
        return builder
                .setConnectTimeout(backstop)
                .setReadTimeout(backstop)
                .build();
    }

    static ThreadPoolExecutor boundedPool(String prefix, int threads, int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), factory, new ThreadPoolExecutor.AbortPolicy());
    }
}
