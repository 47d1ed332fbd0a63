package com.dating.discovery.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.*;


@Configuration
@Slf4j
public class Beans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries only transient store failures around match creation; other errors propagate at once.
     */
    @Bean("matchRetryTemplate")
    public RetryTemplate matchRetryTemplate() {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3, Map.of(
                TransientDataAccessException.class, true
        ), true);
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(50);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(500);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }

    @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(MeterRegistry meterRegistry) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("match-notify-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught error in {}", t.getName(), e))
                .build();

        return new ThreadPoolExecutor(
                2, 4,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1_000),
                threadFactory,
                new ThreadPoolExecutor.DiscardPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("discovery_notification_executor_rejections").increment();
                        log.warn("Match notification dropped: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }
}
