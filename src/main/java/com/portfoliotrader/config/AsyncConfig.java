package com.portfoliotrader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * The engine's two worker threads.
 *
 * <p>{@code engineEventExecutor} is the single control thread: ticks, order updates, trade
 * updates and lifecycle commands run on it one at a time, so per-strategy state needs no
 * locking. Its queue is unbounded because order and trade updates must never be lost;
 * {@code EngineEventDispatcher} caps the tick backlog instead. {@code strategyInitExecutor} runs initializations one at a time, off the event
 * thread, so history loading never delays live events.
 */
@Configuration
public class AsyncConfig {

    private final EngineProperties engineProperties;

    public AsyncConfig(EngineProperties engineProperties) {
        this.engineProperties = engineProperties;
    }

    @Bean("engineEventExecutor")
    public ThreadPoolTaskExecutor engineEventExecutor() {
        return singleWorker("engine-event-", Integer.MAX_VALUE);
    }

    @Bean("strategyInitExecutor")
    public ThreadPoolTaskExecutor strategyInitExecutor() {
        return singleWorker("strategy-init-", engineProperties.getInitQueueCapacity());
    }

    private ThreadPoolTaskExecutor singleWorker(String threadNamePrefix, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
