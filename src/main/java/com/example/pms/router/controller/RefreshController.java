package com.example.pms.router.controller;

import com.example.pms.router.refresh.EmbeddingRefreshWorker;
import com.example.pms.router.response.RefreshResponse;
import com.example.pms.router.validation.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1/embeddings")
@Tag(name = "Embedding Refresh", description = "Manual trigger for the embedding refresh worker")
@RequiredArgsConstructor
public class RefreshController {

    private final EmbeddingRefreshWorker worker;

    @PostMapping("/refresh")
    @Operation(
            summary = "Run the embedding refresh worker",
            description = "Dry runs report stale records and estimated cost without calling the provider or writing."
    )
    public Mono<ResponseEntity<RefreshResponse>> refresh(@RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {
        if (!dryRun && !worker.isEnabled()) {
            return Mono.just(ResponseEntity.badRequest().body(RefreshResponse.builder()
                    .errorCode(ErrorCode.INVALID_REQUEST.name())
                    .errors(List.of("Embedding refresh is disabled; only dry runs are allowed."))
                    .build()));
        }
        return Mono.fromCallable(() -> worker.run(dryRun))
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> report
                        .map(r -> ResponseEntity.ok(RefreshResponse.builder()
                                .report(r)
                                .circuitState(worker.circuitState().name())
                                .build()))
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(RefreshResponse.builder()
                                .errors(List.of("A refresh run is already in progress."))
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure during embedding refresh", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(RefreshResponse.builder()
                            .errors(List.of("Unexpected error occurred."))
                            .build()));
                });
    }
}
