package com.example.pms.router.processor;

import com.example.pms.router.model.RoutingContext;
import reactor.core.publisher.Mono;

public interface TextProcessor {
    String name();
    Mono<RoutingContext> process(RoutingContext ctx);
}
