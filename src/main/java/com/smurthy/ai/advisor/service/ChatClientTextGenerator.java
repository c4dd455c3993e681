package com.smurthy.ai.advisor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link TextGenerator} backed by a Spring AI {@link ChatClient}. Options are set per call so one
 * client serves both the low-temperature classifier and the answer synthesis.
 */
public class ChatClientTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChatClientTextGenerator.class);

    private final ChatClient chatClient;

    public ChatClientTextGenerator(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String generate(String prompt, double temperature, int maxTokens) {
        long start = System.currentTimeMillis();

        String content = chatClient.prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build())
                .call()
                .content();

        log.debug("Generated {} chars in {}ms (temperature={}, maxTokens={})",
                content == null ? 0 : content.length(), System.currentTimeMillis() - start, temperature, maxTokens);
        return content == null ? "" : content;
    }
}
