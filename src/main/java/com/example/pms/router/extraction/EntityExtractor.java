package com.example.pms.router.extraction;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.ExtractedEntity;
import com.example.pms.router.model.Lane;
import com.example.pms.router.validation.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Lane-gated entity extraction: the pattern pass always runs, the model pass only for GPT-lane
 * queries whose pattern result is empty or weak.
 */
@Slf4j
@Service
public class EntityExtractor {

    private static final String NAME = "entity-extractor";

    private final PatternEntityExtractor patternExtractor;
    private final ModelEntityExtractor modelExtractor;
    private final double lowConfidenceThreshold;
    private final Duration modelTimeout;

    @Autowired
    public EntityExtractor(PatternEntityExtractor patternExtractor,
                           ObjectProvider<ModelEntityExtractor> modelExtractor,
                           RouterProperties properties) {
        this(patternExtractor,
                modelExtractor.getIfAvailable(),
                properties.getExtraction().getLowConfidenceThreshold(),
                properties.getExtraction().getModelTimeout());
    }

    public EntityExtractor(PatternEntityExtractor patternExtractor,
                           ModelEntityExtractor modelExtractor,
                           double lowConfidenceThreshold,
                           Duration modelTimeout) {
        this.patternExtractor = Objects.requireNonNull(patternExtractor, "patternExtractor");
        this.modelExtractor = modelExtractor;
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.modelTimeout = Objects.requireNonNull(modelTimeout, "modelTimeout");
    }

    public Mono<ExtractionResult> extract(String text, Lane lane) {
        if (lane == Lane.BLOCKED) {
            // callers short-circuit before this point
            log.warn("[{}] refused to extract for a BLOCKED query", NAME);
            return Mono.just(ExtractionResult.empty());
        }

        List<ExtractedEntity> pattern = patternExtractor.extract(text);
        if (!needsModel(lane, pattern)) {
            return Mono.just(new ExtractionResult(pattern, false, false));
        }

        return modelExtractor.extract(text)
                .timeout(modelTimeout)
                .map(model -> new ExtractionResult(EntityMerger.merge(text, pattern, model), !model.isEmpty(), false))
                .onErrorResume(ex -> {
                    log.warn("[{}] {} model pass failed after {} ms bound ({}); using pattern results",
                            NAME, ErrorCode.EXTRACTION_TIMEOUT, modelTimeout.toMillis(), ex.toString());
                    return Mono.just(new ExtractionResult(pattern, false, true));
                });
    }

    private boolean needsModel(Lane lane, List<ExtractedEntity> pattern) {
        if (lane != Lane.GPT || modelExtractor == null) {
            return false;
        }
        return pattern.isEmpty()
                || pattern.stream().allMatch(e -> e.confidence() < lowConfidenceThreshold);
    }
}
