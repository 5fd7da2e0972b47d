package com.example.pms.router.extraction;

import com.example.pms.router.model.ExtractedEntity;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Second, model-assisted extraction pass. Only invoked for GPT-lane queries whose pattern pass
 * found nothing useful; callers bound it with a timeout.
 */
public interface ModelEntityExtractor {
    Mono<List<ExtractedEntity>> extract(String text);
}
