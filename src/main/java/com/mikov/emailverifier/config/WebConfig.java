package com.mikov.emailverifier.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.concurrent.TimeUnit;

/**
 * Web configuration: streamed bulk responses and the bounded validation pool.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final long STREAMING_TIMEOUT_MS = TimeUnit.HOURS.toMillis(1);

    /**
     * Bulk uploads stream their progress for as long as the job runs
     */
    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setDefaultTimeout(STREAMING_TIMEOUT_MS);
        configurer.setTaskExecutor(asyncTaskExecutor());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**").allowedOriginPatterns("*").allowedMethods("GET", "POST");
    }

    @Bean
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("EmailVerifier-");
        executor.initialize();
        return executor;
    }

    /**
     * Workers for the addresses of one bulk batch; as many threads as a batch has records
     */
    @Bean
    public ThreadPoolTaskExecutor bulkValidationExecutor(@Value("${emailverifier.bulk.batch-size:10}") int batchSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchSize);
        executor.setMaxPoolSize(batchSize);
        executor.setThreadNamePrefix("bulk-validation-");
        executor.initialize();
        return executor;
    }
}
