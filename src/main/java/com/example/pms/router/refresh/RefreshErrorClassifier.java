package com.example.pms.router.refresh;

import com.example.pms.router.validation.ErrorCode;
import dev.langchain4j.exception.HttpException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a provider failure is worth retrying. Throttling, upstream 5xx, timeouts and
 * I/O errors are transient; authentication, other 4xx and unusable results are permanent.
 */
public final class RefreshErrorClassifier {

    static final String AUTH = "AUTH";

    private static final int MAX_CHAIN = 20;

    private RefreshErrorClassifier() {
    }

    public record Classification(String code, boolean retryable, Integer statusCode) {

        public ErrorCode errorCode() {
            return retryable ? ErrorCode.REFRESH_TRANSIENT_FAILURE : ErrorCode.REFRESH_PERMANENT_FAILURE;
        }

        /**
         * Whether the failure says something about the provider's health. Bad input and plain
         * 4xx rejections are about the record and must not open the circuit.
         */
        public boolean dependencyFailure() {
            return retryable || AUTH.equals(code);
        }
    }

    public static Classification classify(Throwable error) {
        List<Throwable> chain = chain(error);

        for (Throwable t : chain) {
            if (t instanceof InvalidEmbeddingException || t instanceof IllegalArgumentException) {
                return new Classification("INVALID_INPUT", false, null);
            }
        }
        for (Throwable t : chain) {
            if (!(t instanceof HttpException http)) {
                continue;
            }
            int status = http.statusCode();
            if (status == 401 || status == 403) {
                return new Classification(AUTH, false, status);
            }
            if (status == 429) {
                return new Classification("RATE_LIMIT", true, status);
            }
            if (status >= 500 && status <= 599) {
                return new Classification("UPSTREAM_5XX", true, status);
            }
            if (status >= 400 && status <= 499) {
                return new Classification("HTTP_4XX", false, status);
            }
        }
        for (Throwable t : chain) {
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (t instanceof TimeoutException || message.contains("timed out") || message.contains("timeout")) {
                return new Classification("TIMEOUT", true, null);
            }
            if (message.contains("rate") && message.contains("limit")) {
                return new Classification("RATE_LIMIT", true, null);
            }
            if (t instanceof IOException) {
                return new Classification("IO", true, null);
            }
        }
        return new Classification("UNKNOWN", true, null);
    }

    private static List<Throwable> chain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CHAIN) {
            chain.add(current);
            Throwable next = current.getCause();
            if (next == current) {
                break;
            }
            current = next;
        }
        return chain;
    }
}
