package com.example.pms.router.validation;

import com.example.pms.router.model.AuthContext;
import org.springframework.stereotype.Component;

/** Rejects requests that do not carry a tenant id; every downstream query is tenant scoped. */
@Component
public class TenantPresentValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUEST;
  }

  @Override
  public void validate(ValidationContext context) {
    AuthContext auth = context.getAuth();
    if (auth == null || !auth.hasTenant()) {
      throw new ValidationException(ErrorCode.MISSING_TENANT, "Tenant id is required.");
    }
    if (auth.role() == null || auth.role().isBlank()) {
      throw new ValidationException(ErrorCode.INVALID_REQUEST, "Caller role is required.");
    }
  }
}
