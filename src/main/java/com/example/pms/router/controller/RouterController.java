package com.example.pms.router.controller;

import com.example.pms.router.model.AuthContext;
import com.example.pms.router.model.FocusedEntity;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.model.RelationResponse;
import com.example.pms.router.model.RoutingContext;
import com.example.pms.router.relation.RelationExpansionEngine;
import com.example.pms.router.request.RouteRequest;
import com.example.pms.router.response.RelatedResponse;
import com.example.pms.router.response.RouteResponse;
import com.example.pms.router.service.QueryRoutingPipeline;
import com.example.pms.router.validation.ErrorCode;
import com.example.pms.router.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/v1")
@Tag(name = "Query Router", description = "Query safety routing and related-record expansion")
@RequiredArgsConstructor
public class RouterController {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    private final QueryRoutingPipeline pipeline;
    private final RelationExpansionEngine relationEngine;

    @PostMapping("/route")
    @Operation(
            summary = "Classify a query and propose actions",
            description = "Runs the safety classifier, entity extraction and capability mapping on the query."
    )
    public Mono<ResponseEntity<RouteResponse>> route(@Valid @RequestBody RouteRequest req,
                                                     @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                                     @RequestHeader(value = USER_HEADER, required = false) String userId,
                                                     @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        AuthContext auth = new AuthContext(userId, tenantId, role);
        return pipeline.run(req == null ? null : req.getQuery(), auth)
                .map(ctx -> ResponseEntity.ok(toResponse(ctx)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(RouteResponse.builder()
                                .errorCode(ex.getCode().name())
                                .errors(List.copyOf(ex.getReasons()))
                                .notices(List.of())
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while routing query", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(RouteResponse.builder()
                            .errors(List.of("Unexpected error occurred."))
                            .notices(List.of())
                            .build()));
                });
    }

    @GetMapping("/related/{entityType}/{entityId}")
    @Operation(
            summary = "Related records for a focused record",
            description = "Returns every relation domain in fixed order, each ordered by link strength then recency."
    )
    public Mono<ResponseEntity<RelatedResponse>> related(@PathVariable("entityType") String entityType,
                                                         @PathVariable("entityId") String entityId,
                                                         @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
                                                         @RequestHeader(value = USER_HEADER, required = false) String userId,
                                                         @RequestHeader(value = ROLE_HEADER, required = false) String role) {
        AuthContext auth = new AuthContext(userId, tenantId, role);
        return Mono.fromCallable(() -> relationEngine.expand(new FocusedEntity(parseType(entityType), entityId, null), auth))
                .subscribeOn(Schedulers.boundedElastic())
                .map(rel -> ResponseEntity.ok(toResponse(rel)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(RelatedResponse.builder()
                                .errorCode(ex.getCode().name())
                                .errors(List.copyOf(ex.getReasons()))
                                .build())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while expanding relations", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(RelatedResponse.builder()
                            .errors(List.of("Unexpected error occurred."))
                            .build()));
                });
    }

    private static RecordType parseType(String raw) {
        try {
            return RecordType.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST, "Unknown entity type: " + raw);
        }
    }

    private static RouteResponse toResponse(RoutingContext ctx) {
        return RouteResponse.builder()
                .requestId(ctx.getRequestId())
                .lane(ctx.getDecision() == null ? null : ctx.getDecision().lane().name())
                .reason(ctx.getDecision() == null ? null : ctx.getDecision().reason())
                .matchedRule(ctx.getDecision() == null ? null : ctx.getDecision().matchedRule())
                .entities(ctx.getEntities() == null ? List.of() : List.copyOf(ctx.getEntities()))
                .modelExtractionUsed(ctx.isModelExtractionUsed())
                .extractionDegraded(ctx.isExtractionDegraded())
                .actions(ctx.getActions() == null ? List.of() : List.copyOf(ctx.getActions()))
                .steps(ctx.getSteps() == null ? List.of() : List.copyOf(ctx.getSteps()))
                .notices(ctx.getValidationNotices() == null ? List.of() : List.copyOf(ctx.getValidationNotices()))
                .errors(List.of())
                .build();
    }

    private static RelatedResponse toResponse(RelationResponse rel) {
        return RelatedResponse.builder()
                .focusType(rel.focusType().value())
                .focusId(rel.focusId())
                .alpha(rel.alpha())
                .totalItems(rel.totalItems())
                .groups(rel.groups())
                .build();
    }
}
