package com.example.pms.router.config;

import com.example.pms.router.capability.CapabilityDao;
import com.example.pms.router.capability.CapabilityRegistry;
import com.example.pms.router.extraction.Gazetteer;
import com.example.pms.router.refresh.Sleeper;
import com.example.pms.router.relation.RelationQueryCatalog;
import com.example.pms.router.relation.TierWeights;
import com.example.pms.router.safety.SafetyRuleSet;
import com.example.pms.router.safety.SafetyRuleSetLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Immutable configuration loaded once at start-up. Any invalid file or setting fails the
 * context instead of surfacing on the request path.
 */
@Slf4j
@Configuration
public class RouterConfig {

    @Bean
    public SafetyRuleSet safetyRuleSet(RouterProperties props, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return SafetyRuleSetLoader.load(resourceLoader.getResource(props.getSafety().getRulesLocation()), objectMapper);
    }

    @Bean
    public Gazetteer gazetteer(RouterProperties props, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return Gazetteer.load(resourceLoader.getResource(props.getExtraction().getGazetteerLocation()), objectMapper);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(CapabilityDao capabilityDao) {
        CapabilityRegistry registry = CapabilityRegistry.from(capabilityDao.loadCatalog());
        log.info("[capability-mapper] Loaded registry version={} actions={}", registry.version(), registry.all().size());
        return registry;
    }

    @Bean
    public TierWeights tierWeights(RouterProperties props) {
        RouterProperties.TierWeights w = props.getRelations().getTierWeights();
        return new TierWeights(w.getDirect(), w.getSameParent(), w.getSameCategory());
    }

    @Bean
    public RelationQueryCatalog relationQueryCatalog() {
        return RelationQueryCatalog.defaults();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
