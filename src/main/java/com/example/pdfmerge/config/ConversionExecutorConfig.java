package com.example.pdfmerge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool shared by all merge jobs for per-file conversions.
 */
@Configuration
public class ConversionExecutorConfig {

    public static final String CONVERSION_EXECUTOR = "conversionExecutor";

    @Bean(name = CONVERSION_EXECUTOR)
    public ThreadPoolTaskExecutor conversionExecutor(PdfMergeProperties properties) {
        int parallelism = properties.pipeline().parallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("pdf-convert-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
