package com.example.pms.router.safety;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads a versioned rule file into a {@link SafetyRuleSet}.
 */
@Slf4j
public final class SafetyRuleSetLoader {

    private SafetyRuleSetLoader() {
    }

    public static SafetyRuleSet load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            SafetyRuleSet rules = SafetyRuleSet.from(objectMapper.readValue(in, SafetyRulesDocument.class));
            log.info("[safety-classifier] Loaded rule set version={} rules={} from {}",
                    rules.getVersion(), rules.ruleCount(), resource.getDescription());
            return rules;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read safety rules from " + resource.getDescription(), e);
        }
    }
}
