package com.starscape.parkfaces.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools backing the face ingestion pipeline.
 *
 * <p>The ingestion pool is fixed-size with a bounded queue. A full queue rejects
 * the submission (AbortPolicy) instead of running it on the caller's thread, so
 * an upload request never ends up doing extraction work.
 *
 * <p>The extraction pool runs the actual model call so the ingestion worker can
 * wait on it with a timeout and interrupt it when the model hangs. It never queues:
 * a call either starts right away or is rejected.
 */
@Configuration
public class IngestionExecutorConfig {

    @Bean(name = "faceIngestionExecutor")
    public ThreadPoolTaskExecutor faceIngestionExecutor(FaceProperties faceProperties) {
        FaceProperties.Ingestion ingestion = faceProperties.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestion.getConcurrency());
        executor.setMaxPoolSize(ingestion.getConcurrency());
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix("face-ingest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) ingestion.getShutdownTimeout().toSeconds());
        return executor;
    }

    @Bean(name = "faceExtractionExecutor")
    public ThreadPoolTaskExecutor faceExtractionExecutor(FaceProperties faceProperties) {
        FaceProperties.Ingestion ingestion = faceProperties.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestion.getConcurrency());
        // A timed-out call holds its thread until the HTTP read timeout; new calls must not queue behind it
        executor.setMaxPoolSize(ingestion.getConcurrency() * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("face-extract-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
