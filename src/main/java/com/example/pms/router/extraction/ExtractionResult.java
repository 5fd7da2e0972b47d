package com.example.pms.router.extraction;

import com.example.pms.router.model.ExtractedEntity;

import java.util.List;

/**
 * @param modelUsed whether the model pass ran and contributed
 * @param degraded  whether the model pass was attempted but timed out or failed
 */
public record ExtractionResult(List<ExtractedEntity> entities, boolean modelUsed, boolean degraded) {

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), false, false);
    }
}
