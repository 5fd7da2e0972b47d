package com.example.pms.router.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(Langchain4jOpenAiProperties.class)
public class Langchain4jConfig {

    @Bean
    @ConditionalOnProperty(name = "router.extraction.model-enabled", havingValue = "true", matchIfMissing = true)
    public ChatModel chatModel(Langchain4jOpenAiProperties props) {
        return OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getChatModel())
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxOutputTokens())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(Langchain4jOpenAiProperties props) {
        // local model when no key is configured
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            return new AllMiniLmL6V2EmbeddingModel();
        }

        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .build();
    }
}
