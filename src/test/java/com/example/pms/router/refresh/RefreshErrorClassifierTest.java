package com.example.pms.router.refresh;

import com.example.pms.router.validation.ErrorCode;
import dev.langchain4j.exception.HttpException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class RefreshErrorClassifierTest {

  @Test
  void throttlingAndServerErrorsAreTransient() {
    assertThat(RefreshErrorClassifier.classify(new HttpException(429, "slow down")).code()).isEqualTo("RATE_LIMIT");
    RefreshErrorClassifier.Classification upstream = RefreshErrorClassifier.classify(new HttpException(503, "unavailable"));
    assertThat(upstream.code()).isEqualTo("UPSTREAM_5XX");
    assertThat(upstream.retryable()).isTrue();
    assertThat(upstream.statusCode()).isEqualTo(503);
    assertThat(upstream.errorCode()).isEqualTo(ErrorCode.REFRESH_TRANSIENT_FAILURE);
  }

  @Test
  void authAndBadRequestsArePermanent() {
    RefreshErrorClassifier.Classification auth = RefreshErrorClassifier.classify(new HttpException(401, "bad key"));
    assertThat(auth.code()).isEqualTo("AUTH");
    assertThat(auth.retryable()).isFalse();
    assertThat(RefreshErrorClassifier.classify(new HttpException(400, "too long")).code()).isEqualTo("HTTP_4XX");
    assertThat(RefreshErrorClassifier.classify(new HttpException(400, "too long")).errorCode())
        .isEqualTo(ErrorCode.REFRESH_PERMANENT_FAILURE);
  }

  @Test
  void unusableResultIsPermanent() {
    RefreshErrorClassifier.Classification cls = RefreshErrorClassifier.classify(new InvalidEmbeddingException("dimension 3"));

    assertThat(cls.code()).isEqualTo("INVALID_INPUT");
    assertThat(cls.retryable()).isFalse();
  }

  @Test
  void wrappedCausesAreInspected() {
    RuntimeException wrapped = new RuntimeException("call failed", new HttpException(502, "bad gateway"));
    assertThat(RefreshErrorClassifier.classify(wrapped).code()).isEqualTo("UPSTREAM_5XX");

    RuntimeException timeout = new RuntimeException(new TimeoutException());
    assertThat(RefreshErrorClassifier.classify(timeout).code()).isEqualTo("TIMEOUT");

    assertThat(RefreshErrorClassifier.classify(new UncheckedIOException(new IOException("connection reset"))).code())
        .isEqualTo("IO");
  }

  @Test
  void unknownFailuresAreRetried() {
    RefreshErrorClassifier.Classification cls = RefreshErrorClassifier.classify(new IllegalStateException("boom"));

    assertThat(cls.code()).isEqualTo("UNKNOWN");
    assertThat(cls.retryable()).isTrue();
  }

  @Test
  void onlyProviderHealthFailuresCountAgainstTheCircuit() {
    assertThat(RefreshErrorClassifier.classify(new HttpException(503, "unavailable")).dependencyFailure()).isTrue();
    assertThat(RefreshErrorClassifier.classify(new HttpException(401, "bad key")).dependencyFailure()).isTrue();
    assertThat(RefreshErrorClassifier.classify(new HttpException(400, "too long")).dependencyFailure()).isFalse();
    assertThat(RefreshErrorClassifier.classify(new InvalidEmbeddingException("dimension 3")).dependencyFailure()).isFalse();
    assertThat(RefreshErrorClassifier.classify(new IllegalArgumentException("text is blank")).dependencyFailure()).isFalse();
  }
}
