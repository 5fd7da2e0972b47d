package com.example.pms.router.controller;

import com.example.pms.router.refresh.CircuitBreaker;
import com.example.pms.router.refresh.EmbeddingRefreshWorker;
import com.example.pms.router.refresh.RefreshRunReport;
import com.example.pms.router.response.RefreshResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefreshControllerTest {

  private final EmbeddingRefreshWorker worker = mock(EmbeddingRefreshWorker.class);
  private final RefreshController controller = new RefreshController(worker);

  @Test
  void dryRunIsAllowedWhileDisabled() {
    RefreshRunReport report = new RefreshRunReport(true, 0.02, Instant.EPOCH);
    when(worker.isEnabled()).thenReturn(false);
    when(worker.run(true)).thenReturn(Optional.of(report));
    when(worker.circuitState()).thenReturn(CircuitBreaker.State.CLOSED);

    ResponseEntity<RefreshResponse> response = controller.refresh(true).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getReport()).isSameAs(report);
    assertThat(response.getBody().getCircuitState()).isEqualTo("CLOSED");
  }

  @Test
  void liveRunIsRejectedWhileDisabled() {
    when(worker.isEnabled()).thenReturn(false);

    ResponseEntity<RefreshResponse> response = controller.refresh(false).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getErrorCode()).isEqualTo("INVALID_REQUEST");
    verify(worker, never()).run(anyBoolean());
  }

  @Test
  void activeRunReturnsConflict() {
    when(worker.isEnabled()).thenReturn(true);
    when(worker.run(false)).thenReturn(Optional.empty());

    ResponseEntity<RefreshResponse> response = controller.refresh(false).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(409);
  }

  @Test
  void unexpectedFailureReturnsServerError() {
    when(worker.isEnabled()).thenReturn(true);
    when(worker.run(false)).thenThrow(new IllegalStateException("pool exhausted"));

    ResponseEntity<RefreshResponse> response = controller.refresh(false).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(500);
  }
}
