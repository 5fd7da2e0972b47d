package com.example.pms.router.validation;

import com.example.pms.router.model.AuthContext;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Runs all registered {@link Validator} beans in stage order for an incoming query.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  public ValidationContext validate(String rawInput, AuthContext auth) {
    ValidationContext context = new ValidationContext(rawInput, auth);
    for (Validator validator : orderedValidators) {
      validator.validate(context);
    }
    return context;
  }
}
