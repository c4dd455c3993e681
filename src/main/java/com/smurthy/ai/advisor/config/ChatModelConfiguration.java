package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.service.ChatClientTextGenerator;
import com.smurthy.ai.advisor.service.TextGenerator;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Binds the text-generation capability to the auto-configured Spring AI chat model.
 *
 * The classifier and the responder share one {@link TextGenerator}; each call passes its own
 * temperature and token cap.
 */
@Configuration
public class ChatModelConfiguration {

    @Bean
    public TextGenerator textGenerator(ChatClient.Builder chatClientBuilder) {
        return new ChatClientTextGenerator(chatClientBuilder.build());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
