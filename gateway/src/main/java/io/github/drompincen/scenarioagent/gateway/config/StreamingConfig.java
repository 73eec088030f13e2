package io.github.drompincen.scenarioagent.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Executor and timeout for streamed responses. The timeout must outlast the stall of
 * {@code timeout_scenario} so the client, not the server, gives up first.
 */
@Configuration
public class StreamingConfig implements WebMvcConfigurer {

    private final long streamTimeoutMs;

    public StreamingConfig(@Value("${scenario-agent.stream-timeout-ms:900000}") long streamTimeoutMs) {
        this.streamTimeoutMs = streamTimeoutMs;
    }

    @Bean
    ThreadPoolTaskExecutor streamExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        // One thread per open stream; a stalled stream holds its thread until the stall ends.
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamExecutor());
        configurer.setDefaultTimeout(streamTimeoutMs);
    }
}
