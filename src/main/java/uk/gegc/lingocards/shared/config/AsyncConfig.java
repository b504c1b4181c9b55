package uk.gegc.lingocards.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool used for blocking calls to the text generation provider.
 * Callers wait on the returned futures with a timeout, so the pool only bounds
 * how many provider round trips run at once.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.ai.core-pool-size:4}")
    private int aiCorePoolSize;

    @Value("${async.ai.max-pool-size:8}")
    private int aiMaxPoolSize;

    @Value("${async.ai.queue-capacity:50}")
    private int aiQueueCapacity;

    @Value("${async.ai.keep-alive-seconds:60}")
    private int aiKeepAliveSeconds;

    @Bean(name = "aiTaskExecutor")
    public ThreadPoolTaskExecutor aiTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiCorePoolSize);
        executor.setMaxPoolSize(aiMaxPoolSize);
        executor.setQueueCapacity(aiQueueCapacity);
        executor.setKeepAliveSeconds(aiKeepAliveSeconds);
        executor.setThreadNamePrefix("ai-");

        // caller runs the task if queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("AI Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                aiCorePoolSize, aiMaxPoolSize, aiQueueCapacity, aiKeepAliveSeconds);

        return executor;
    }
}
