package gmail.cleanup.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for background mailbox work.
 * The sync pool has a single thread since only one scan may run at a time.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "syncExecutor")
    public Executor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("mailbox-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "trashExecutor")
    public Executor trashExecutor(@Value("${cleanup.rate-limit.max-concurrency:4}") int maxConcurrency) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrency); // Matches the rate limiter, more threads would only wait
        executor.setMaxPoolSize(maxConcurrency);
        executor.setQueueCapacity(1000); // Queue capacity in chunks
        executor.setThreadNamePrefix("bulk-trash-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
