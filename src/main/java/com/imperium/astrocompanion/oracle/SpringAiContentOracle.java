package com.imperium.astrocompanion.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring AI {@link ChatClient} 的 Content Oracle 实现。
 */
@Component
public class SpringAiContentOracle implements ContentOracle {

    private static final Logger log = LoggerFactory.getLogger(SpringAiContentOracle.class);

    private final ChatClient chatClient;

    @Value("${app.oracle.temperature:0.85}")
    private double temperature = 0.85;

    @Value("${app.oracle.max-tokens:2000}")
    private int maxTokens = 2000;

    public SpringAiContentOracle(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String generate(OracleRequest request) {
        long startMs = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt()
                    .system(OraclePrompts.SYSTEM_PROMPT)
                    .user(OraclePrompts.userPrompt(request))
                    .options(OpenAiChatOptions.builder()
                            .temperature(temperature)
                            .maxTokens(maxTokens)
                            .build())
                    .call()
                    .content();
        } catch (Exception e) {
            throw new ContentOracleException(request.getKind(), "Oracle call failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new ContentOracleException(request.getKind(), "Oracle returned empty content");
        }
        log.debug("Oracle {} answered in {} ms ({} chars)", request.getKind(),
                System.currentTimeMillis() - startMs, content.length());
        return content.trim();
    }
}
