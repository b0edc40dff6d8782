package com.starscape.rapidvariant.common.config;

import com.starscape.rapidvariant.features.generatevariants.app.EncodingOffload;
import com.starscape.rapidvariant.features.generatevariants.app.VariantEncoder;
import com.starscape.rapidvariant.features.generatevariants.domain.VariantPlan;
import com.starscape.rapidvariant.features.uploadvariants.domain.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Executors and derived settings shared by the pipeline slices.
 */
@Configuration
public class PipelineConfig {
    
    /**
     * Validated once at startup; an invalid plan fails the context.
     */
    @Bean
    public VariantPlan variantPlan(PipelineProperties properties) {
        return properties.toVariantPlan();
    }
    
    @Bean
    public RetryPolicy uploadRetryPolicy(PipelineProperties properties) {
        return properties.toRetryPolicy();
    }
    
    @Bean(destroyMethod = "shutdown")
    public EncodingOffload encodingOffload(VariantEncoder encoder, PipelineProperties properties) {
        return new EncodingOffload(encoder, properties.getOffload().getWorkers(), properties.getOffload().isEnabled());
    }
    
    /**
     * Runs individual uploads. Sized so several runs can each have a full batch in flight.
     */
    @Bean
    public ThreadPoolTaskExecutor variantUploadExecutor(PipelineProperties properties) {
        int concurrency = Math.max(1, properties.getUpload().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency * 4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("variant-upload-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
    
    /**
     * Drives whole runs started over REST; each run orchestrates sequentially on one of these threads.
     */
    @Bean
    public ThreadPoolTaskExecutor pipelineRunExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("pipeline-run-");
        return executor;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
