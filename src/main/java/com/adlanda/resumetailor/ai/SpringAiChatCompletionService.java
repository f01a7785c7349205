package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.config.TailoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

/**
 * Chat completions through Spring AI's {@link ChatClient}.
 *
 * Works against any OpenAI-compatible endpoint (Groq by default). Spring AI's
 * own retry is switched off in configuration; {@link ResilientCaller} owns retries.
 */
@Service
public class SpringAiChatCompletionService implements ChatCompletionService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiChatCompletionService.class);

    private final ChatClient chatClient;
    private final int maxTokens;

    public SpringAiChatCompletionService(ChatClient chatClient, TailoringProperties properties) {
        this.chatClient = chatClient;
        this.maxTokens = properties.getAi().getMaxTokens();
    }

    @Override
    public String complete(String model, double temperature, String prompt) {
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        String content = chatClient.prompt()
                .options(options)
                .user(prompt)
                .call()
                .content();

        log.debug("Model {} answered with {} characters", model, content == null ? 0 : content.length());
        return content;
    }
}
