package com.example.pms.router.request;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RouteRequestTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void missingQuery_isRejected() {
    Set<ConstraintViolation<RouteRequest>> violations = validator.validate(new RouteRequest());

    assertThat(violations).extracting(v -> v.getPropertyPath().toString()).containsExactly("query");
  }

  @Test
  void blankQuery_isAcceptedForClassification() {
    assertThat(validator.validate(RouteRequest.builder().query("  ").build())).isEmpty();
    assertThat(validator.validate(RouteRequest.builder().query("ME1 fault E047").build())).isEmpty();
  }
}
