package com.tradecore.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Gateway call infrastructure: the executor that runs gateway calls and the
 * resilience4j {@link TimeLimiter} that bounds each call. A saturated executor rejects
 * new calls instead of running them on the caller.
 *
 * <p>Properties prefix: {@code tradecore.gateway.*}.
 */
@Configuration
public class GatewayConfig {

    @Value("${tradecore.gateway.timeout-ms:2000}")
    private long timeoutMs;

    @Value("${tradecore.gateway.core-pool-size:2}")
    private int corePoolSize;

    @Value("${tradecore.gateway.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${tradecore.gateway.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public TimeLimiter gatewayTimeLimiter() {
        return TimeLimiter.of(
                "orderGateway",
                TimeLimiterConfig.custom()
                        .timeoutDuration(Duration.ofMillis(timeoutMs))
                        .cancelRunningFuture(true)
                        .build());
    }

    @Bean("gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("gateway-");
        // Never run a gateway call on the submitting thread, the time limit could not bound it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
