package com.example.pms.router.refresh;

import com.example.pms.router.config.RouterProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Embeds through the configured langchain4j {@link EmbeddingModel}.
 */
@Component
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final int expectedDimension;

    @Autowired
    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, RouterProperties properties) {
        this(embeddingModel, properties.getRefresh().getDimension());
    }

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, int expectedDimension) {
        this.embeddingModel = embeddingModel;
        this.expectedDimension = expectedDimension;
    }

    @Override
    public float[] embed(String text) {
        Embedding embedding = embeddingModel.embed(text).content();
        if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
            throw new InvalidEmbeddingException("Provider returned an empty embedding");
        }
        float[] vector = embedding.vector();
        if (expectedDimension > 0 && vector.length != expectedDimension) {
            throw new InvalidEmbeddingException(
                    "Embedding dimension " + vector.length + " does not match expected " + expectedDimension);
        }
        return vector;
    }

    @Override
    public String modelName() {
        return embeddingModel.getClass().getSimpleName();
    }
}
