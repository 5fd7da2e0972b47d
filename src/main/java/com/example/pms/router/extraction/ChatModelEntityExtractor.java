package com.example.pms.router.extraction;

import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ModelEntityExtractor} backed by a LangChain4j {@link ChatModel} that answers with a JSON array.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "router.extraction.model-enabled", havingValue = "true", matchIfMissing = true)
public class ChatModelEntityExtractor implements ModelEntityExtractor {

    static final double DEFAULT_CONFIDENCE = 0.6;

    private static final String PROMPT = """
            Extract maritime maintenance entities from the query below.
            Answer with a JSON array only, each element {"type": T, "text": S, "confidence": C}
            where T is one of EQUIPMENT, PART, PART_NUMBER, FAULT_CODE, SYMPTOM, MEASUREMENT,
            WORK_ORDER_NUMBER, PO_NUMBER and S is copied from the query. Answer [] if there are none.

            Query: %s
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<List<ExtractedEntity>> extract(String text) {
        return Mono.fromCallable(() -> chatModel.chat(PROMPT.formatted(text)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::parse);
    }

    List<ExtractedEntity> parse(String answer) {
        String json = stripFence(answer);
        ModelEntity[] raw;
        try {
            raw = objectMapper.readValue(json, ModelEntity[].class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Model answer is not a JSON entity array", e);
        }
        List<ExtractedEntity> out = new ArrayList<>(raw.length);
        for (ModelEntity e : raw) {
            if (e == null || e.text == null || e.text.isBlank()) {
                continue;
            }
            EntityType type = EntityType.fromName(e.type);
            if (type == null) {
                log.debug("[entity-extractor] dropping model entity with unknown type '{}'", e.type);
                continue;
            }
            double confidence = e.confidence == null ? DEFAULT_CONFIDENCE : Math.max(0.0, Math.min(1.0, e.confidence));
            String value = e.text.trim();
            out.add(new ExtractedEntity(type, value, value, confidence, EntitySource.MODEL, -1));
        }
        return out;
    }

    private static String stripFence(String answer) {
        if (answer == null) {
            return "[]";
        }
        String s = answer.strip();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            int lastFence = s.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                s = s.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return s.isEmpty() ? "[]" : s;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ModelEntity {
        public String type;
        public String text;
        public Double confidence;
    }
}
