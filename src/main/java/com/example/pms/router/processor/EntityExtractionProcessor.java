package com.example.pms.router.processor;

import com.example.pms.router.extraction.EntityExtractor;
import com.example.pms.router.model.RoutingContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class EntityExtractionProcessor implements TextProcessor {

    private final EntityExtractor extractor;

    @Override
    public String name() {
        return "entity-extractor";
    }

    @Override
    public Mono<RoutingContext> process(RoutingContext ctx) {
        return extractor.extract(ctx.getRawInput(), ctx.getDecision().lane())
                .map(result -> {
                    ctx.setEntities(result.entities());
                    ctx.setModelExtractionUsed(result.modelUsed());
                    ctx.setExtractionDegraded(result.degraded());
                    String note = "entities=" + result.entities().size()
                            + (result.modelUsed() ? " model" : "")
                            + (result.degraded() ? " degraded" : "");
                    return ctx.addStep(name(), note);
                });
    }
}
