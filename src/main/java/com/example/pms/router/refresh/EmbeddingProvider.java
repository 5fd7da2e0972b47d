package com.example.pms.router.refresh;

/**
 * Source of embedding vectors for the refresh worker.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    String modelName();
}
