package com.marketpulse.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;

/**
 * {@link AiProvider} that wraps a Spring AI {@link ChatClient}.
 */
public class ChatClientAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAiProvider.class);

    private final String name;
    private final ChatClient chatClient;

    public ChatClientAiProvider(String name, ChatClient chatClient) {
        this.name = name;
        this.chatClient = chatClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String generate(String prompt, int maxTokens) {
        long start = System.currentTimeMillis();
        String content = chatClient.prompt()
                .user(prompt)
                .options(OpenAiChatOptions.builder().maxTokens(maxTokens).build())
                .call()
                .content();
        log.info("AI provider {} responded in {}s", name,
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("AI provider " + name + " returned empty content");
        }
        return content;
    }
}
