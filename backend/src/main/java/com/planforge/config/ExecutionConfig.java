package com.planforge.config;

import com.planforge.common.concurrent.BackgroundTaskSupervisor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool(named("provider-call-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(named("plan-stream-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    ScheduledExecutorService streamTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(named("stream-timeout-"));
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService backgroundExecutor() {
        return Executors.newFixedThreadPool(2, named("background-"));
    }

    @Bean
    BackgroundTaskSupervisor backgroundTaskSupervisor(@Qualifier("backgroundExecutor") ExecutorService backgroundExecutor) {
        return new BackgroundTaskSupervisor(backgroundExecutor);
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
