package com.example.pms.router.service;

import com.example.pms.router.model.AuthContext;
import com.example.pms.router.model.RoutingContext;
import com.example.pms.router.processor.CapabilityMappingProcessor;
import com.example.pms.router.processor.EntityExtractionProcessor;
import com.example.pms.router.processor.ExtractionAuditProcessor;
import com.example.pms.router.processor.SafetyClassifierProcessor;
import com.example.pms.router.processor.TextProcessor;
import com.example.pms.router.validation.ValidationContext;
import com.example.pms.router.validation.ValidationException;
import com.example.pms.router.validation.ValidationService;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs a query through validation, classification, extraction and capability mapping. Once the
 * classifier blocks a query, every later stage is bypassed.
 */
@Service
public class QueryRoutingPipeline {

  // Classifier must run first; nothing downstream may see a blocked query
  private static final List<Class<? extends TextProcessor>> DEFAULT_ORDER = List.of(
          SafetyClassifierProcessor.class,
          EntityExtractionProcessor.class,
          CapabilityMappingProcessor.class,
          ExtractionAuditProcessor.class
  );

  private final Map<Class<? extends TextProcessor>, TextProcessor> processorsByType;
  private final ValidationService validationService;

  public QueryRoutingPipeline(List<TextProcessor> processors, ValidationService validationService) {
    this.processorsByType = processors.stream()
        .collect(Collectors.toMap(
            QueryRoutingPipeline::getConcreteType,
            Function.identity(),
            (left, right) -> left,
            LinkedHashMap::new
        ));
    this.validationService = validationService;
  }

  public Mono<RoutingContext> run(String query, AuthContext auth) {
    RoutingContext ctx;
    try {
      ctx = initializeContext(query, auth);
    } catch (ValidationException ex) {
      return Mono.error(ex);
    }

    Mono<RoutingContext> pipeline = Mono.just(ctx);
    for (TextProcessor processor : buildOrderedChain()) {
      final TextProcessor stage = processor;
      pipeline = pipeline.flatMap(current -> {
        if (current.isBlocked() && !(stage instanceof SafetyClassifierProcessor)) {
          return Mono.just(current.addStep(stage.name(), RoutingContext.BYPASS_BLOCKED));
        }
        return stage.process(current);
      });
    }
    return pipeline;
  }

  private RoutingContext initializeContext(String query, AuthContext auth) throws ValidationException {
    ValidationContext validation = validationService.validate(query, auth);
    return new RoutingContext()
        .setRequestId(UUID.randomUUID().toString())
        .setAuth(auth)
        .setRawInput(validation.getProcessedInput())
        .setOriginalInput(query)
        .setNow(Instant.now())
        .setValidationNotices(new ArrayList<>(validation.getNotices()));
  }

  private List<TextProcessor> buildOrderedChain() {
    Set<TextProcessor> seen = new LinkedHashSet<>();
    List<TextProcessor> ordered = new ArrayList<>();

    for (Class<? extends TextProcessor> type : DEFAULT_ORDER) {
      TextProcessor processor = processorsByType.get(type);
      if (processor != null && seen.add(processor)) {
        ordered.add(processor);
      }
    }
    for (TextProcessor processor : processorsByType.values()) {
      if (seen.add(processor)) {
        ordered.add(processor);
      }
    }
    return ordered;
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends TextProcessor> getConcreteType(TextProcessor p) {
    Class<?> target = AopUtils.getTargetClass(p);
    if (target == null || !TextProcessor.class.isAssignableFrom(target)) {
      target = p.getClass();
    }
    return (Class<? extends TextProcessor>) target;
  }
}
