package com.adlanda.resumetailor.config;

import com.adlanda.resumetailor.ai.AiResponseParser;
import com.adlanda.resumetailor.ai.ResilientCaller;
import com.adlanda.resumetailor.ai.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AiConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public RetryPolicy retryPolicy(TailoringProperties properties) {
        TailoringProperties.Ai ai = properties.getAi();
        return new RetryPolicy(ai.getMaxRetries(), ai.getBackoffUnit());
    }

    @Bean
    public ResilientCaller resilientCaller(RetryPolicy retryPolicy) {
        return new ResilientCaller(retryPolicy);
    }

    @Bean
    public AiResponseParser aiResponseParser(ObjectMapper objectMapper) {
        return new AiResponseParser(objectMapper);
    }

    /**
     * Pool for parallel bullet tailoring. Only used when tailor.parallel-tailoring is on.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService tailoringExecutor(TailoringProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getTailoringThreads()), runnable -> {
            Thread thread = new Thread(runnable, "tailoring-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
