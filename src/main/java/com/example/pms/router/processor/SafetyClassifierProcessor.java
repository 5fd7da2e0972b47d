package com.example.pms.router.processor;

import com.example.pms.router.model.LaneDecision;
import com.example.pms.router.model.RoutingContext;
import com.example.pms.router.safety.SafetyClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@RequiredArgsConstructor
public class SafetyClassifierProcessor implements TextProcessor {

    private static final String NAME = "safety-classifier";

    private final SafetyClassifier classifier;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<RoutingContext> process(RoutingContext ctx) {
        LaneDecision decision = classifier.classify(ctx.getClassificationInput());
        ctx.setDecision(decision);
        if (decision.isBlocked()) {
            log.info("[{}] request={} blocked reason={} rule={}", NAME, ctx.getRequestId(),
                    decision.reason(), decision.matchedRule());
        }
        return Mono.just(ctx.addStep(NAME, decision.lane() + "/" + decision.reason()
                + " rule=" + decision.matchedRule() + " v=" + classifier.rulesVersion()));
    }
}
