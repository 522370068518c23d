package github.sarthakdev143.uniq_publisher.config;

import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import github.sarthakdev143.uniq_publisher.transform.TransformBounds;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools, HTTP transport and transform bounds shared by the pipeline.
 */
@Configuration
@EnableConfigurationProperties(UniqPublisherProperties.class)
public class PipelineConfig {

    @Bean
    public TransformBounds transformBounds(UniqPublisherProperties properties) {
        return properties.getTransform().toBounds();
    }

    @Bean(name = "batchTaskExecutor")
    public ThreadPoolTaskExecutor batchTaskExecutor(UniqPublisherProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getBatch().getExecutorThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getBatch().getExecutorQueueCapacity());
        executor.setThreadNamePrefix("batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * One thread per allowed in-flight request. The pool caps requests across concurrent batches, so the
     * queue is left unbounded and dispatches wait in it instead of being rejected.
     */
    @Bean(name = "publishTaskExecutor")
    public ThreadPoolTaskExecutor publishTaskExecutor(UniqPublisherProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getPublish().getMaxConcurrency());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("publish-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "publishRetryScheduler")
    public ThreadPoolTaskScheduler publishRetryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("publish-retry-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public HttpTransport httpTransport() {
        return new NetHttpTransport();
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
