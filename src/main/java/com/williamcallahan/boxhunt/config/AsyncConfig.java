/**
 * Configuration for the image processing worker pool
 *
 * @author William Callahan
 *
 * Features:
 * - Dedicated thread pool for CPU-bound decode, hash and encode work
 * - Exposes the pool as a Reactor Scheduler for pipeline stages
 * - Implements custom thread naming for easier debugging
 */

package com.williamcallahan.boxhunt.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Creates and configures a dedicated thread pool task executor for CPU-intensive image processing
     *
     * @return Configured AsyncTaskExecutor for image processing tasks
     *
     * Features:
     * - Core pool size based on available processors
     * - Max pool size also based on available processors (can be slightly higher for burst)
     * - Smaller queue capacity as tasks are expected to be CPU-bound
     * - Fallback to caller thread when saturated (CallerRunsPolicy)
     */
    @Bean("imageProcessingExecutor")
    public AsyncTaskExecutor imageProcessingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int processors = Runtime.getRuntime().availableProcessors();
        executor.setCorePoolSize(processors > 1 ? processors : 2);
        executor.setMaxPoolSize(processors > 1 ? processors * 2 : 4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("image-proc-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Reactor view of the image processing pool
     */
    @Bean("imageProcessingScheduler")
    public Scheduler imageProcessingScheduler(@Qualifier("imageProcessingExecutor") AsyncTaskExecutor executor) {
        return Schedulers.fromExecutor(executor);
    }
}
