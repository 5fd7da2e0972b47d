package com.example.pms.router.processor;

import com.example.pms.router.capability.CapabilityMapper;
import com.example.pms.router.model.CandidateAction;
import com.example.pms.router.model.RoutingContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
public class CapabilityMappingProcessor implements TextProcessor {

    private final CapabilityMapper mapper;

    @Override
    public String name() {
        return "capability-mapper";
    }

    @Override
    public Mono<RoutingContext> process(RoutingContext ctx) {
        List<CandidateAction> actions = mapper.map(ctx.getEntities(), ctx.getDecision().lane(), ctx.getAuth());
        ctx.setActions(actions);
        return Mono.just(ctx.addStep(name(), "actions=" + actions.size() + " role=" + ctx.getAuth().role()));
    }
}
