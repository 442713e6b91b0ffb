package com.nevis.notebook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // job concurrency is bounded by the worker slots of ContentQueueWorker
    @Bean(name = "pipelineTaskExecutor")
    public Executor pipelineTaskExecutor() {
        return new SimpleAsyncTaskExecutor("pipeline-");
    }

    @Bean(name = "embeddingTaskExecutor")
    public Executor embeddingTaskExecutor(EmbeddingProperties props) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("embedding-");
        executor.setConcurrencyLimit(props.maxConcurrency() * 2);
        return executor;
    }
}
