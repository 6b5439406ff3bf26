package com.optionengine.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads outside the event listeners.
 *
 * <ul>
 *   <li>{@code taskScheduler}: order watchdogs, simulator limit monitors and the
 *       {@code @Scheduled} square-off check</li>
 *   <li>{@code fillCallbackExecutor}: single thread, so simulated fills for one order are
 *       delivered in the order they were produced</li>
 *   <li>{@code signalExecutor}: single thread, so entry placement (which polls for a price)
 *       never blocks the tick thread and signals are handled one at a time</li>
 * </ul>
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${engine.async.scheduler-pool-size:4}")
    private int schedulerPoolSize;

    @Value("${engine.async.queue-capacity:1000}")
    private int queueCapacity;

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("engine-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /** Keeps accepting work after context close so shutdown exits still deliver their fills. */
    @Bean("fillCallbackExecutor")
    public ThreadPoolTaskExecutor fillCallbackExecutor() {
        ThreadPoolTaskExecutor executor = singleThread("fill-");
        executor.setAcceptTasksAfterContextClose(true);
        return executor;
    }

    @Bean("signalExecutor")
    public ThreadPoolTaskExecutor signalExecutor() {
        return singleThread("signal-");
    }

    private ThreadPoolTaskExecutor singleThread(String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
