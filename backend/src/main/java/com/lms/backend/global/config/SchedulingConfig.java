package com.lms.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    public static final String DISPATCH_EXECUTOR = "inactivityDispatchExecutor";

    /**
     * Bounded pool for per-candidate dispatch. The bound is the only rate limit applied to the mail
     * transport. On shutdown running sends are allowed to finish; queued ones are handled by the scan
     * cycle itself.
     */
    @Bean(name = DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor inactivityDispatchExecutor(
            @Value("${lms.inactivity.dispatch.workers:4}") int workers,
            @Value("${lms.inactivity.dispatch.shutdown-await-seconds:30}") int awaitSeconds
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("inactivity-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitSeconds);
        executor.initialize();
        return executor;
    }
}
