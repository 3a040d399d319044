package com.planforge.jobs.worker;

import com.planforge.common.concurrent.BackgroundTaskSupervisor;
import com.planforge.config.AppProperties;
import com.planforge.jobs.handler.JobHandler;
import com.planforge.jobs.service.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@ConditionalOnProperty(value = "app.worker.enabled", havingValue = "true", matchIfMissing = true)
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    JobWorker jobWorker(JobStore jobStore,
                        List<JobHandler> handlers,
                        AppProperties appProperties,
                        MeterRegistry meterRegistry,
                        BackgroundTaskSupervisor backgroundTasks) {
        AppProperties.Worker config = appProperties.worker();
        JobWorker worker = new JobWorker(jobStore, handlers, config, new WorkerStats(meterRegistry));
        // usage rows and enrichment queued by the last jobs
        worker.registerCloseable(() -> {
            if (!backgroundTasks.awaitIdle(config.shutdownTimeout())) {
                log.warn("{} background task(s) still running at worker shutdown", backgroundTasks.inFlight());
            }
        });
        return worker;
    }
}
