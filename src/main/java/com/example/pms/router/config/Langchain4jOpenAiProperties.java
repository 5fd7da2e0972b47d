package com.example.pms.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.chat-model=...
 * langchain4j.openai.embedding-model=...
 * langchain4j.openai.temperature=0.0
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key. Without one, embeddings come from the local model.
     */
    private String apiKey;

    /**
     * Chat model used for assisted entity extraction, e.g. "gpt-4o-mini"
     */
    private String chatModel = "gpt-4o-mini";

    private String embeddingModel = "text-embedding-3-small";

    /**
     * Extraction wants deterministic answers.
     */
    private double temperature = 0.0;

    private Integer maxOutputTokens = 300;
}
