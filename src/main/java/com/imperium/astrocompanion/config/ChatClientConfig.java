package com.imperium.astrocompanion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.astrocompanion.oracle.ForecastParser;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Content Oracle 相关 bean。spring-ai-starter-model-openai 自动配置 ChatModel 与 ChatClient.Builder。
 */
@Configuration
public class ChatClientConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public ForecastParser forecastParser(ObjectMapper objectMapper) {
        return new ForecastParser(objectMapper);
    }
}
