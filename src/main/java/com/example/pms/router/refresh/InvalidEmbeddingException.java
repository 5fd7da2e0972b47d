package com.example.pms.router.refresh;

/**
 * The provider answered, but the result cannot be stored. Never retried.
 */
public class InvalidEmbeddingException extends RuntimeException {

    public InvalidEmbeddingException(String message) {
        super(message);
    }
}
