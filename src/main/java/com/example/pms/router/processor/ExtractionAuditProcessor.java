package com.example.pms.router.processor;

import com.example.pms.router.audit.ExtractionAuditService;
import com.example.pms.router.model.RoutingContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class ExtractionAuditProcessor implements TextProcessor {

    private final ExtractionAuditService auditService;

    @Override
    public String name() {
        return "extraction-audit";
    }

    @Override
    public Mono<RoutingContext> process(RoutingContext ctx) {
        if (!auditService.isEnabled()) {
            return Mono.just(ctx.addStep(name(), "disabled"));
        }
        if (ctx.getEntities() == null || ctx.getEntities().isEmpty()) {
            return Mono.just(ctx.addStep(name(), "skip-empty"));
        }
        return auditService.record(ctx)
                .map(saved -> ctx.addStep(name(), saved ? "recorded" : "failed"));
    }
}
