package com.example.pms.router.validation;

import com.example.pms.router.model.AuthContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the query text and caller context through the validation stages. Validators can rewrite
 * the processed input and attach notices.
 */
public class ValidationContext {

  private final String rawInput;
  private final AuthContext auth;
  private String processedInput;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawInput, AuthContext auth) {
    this.rawInput = rawInput;
    this.processedInput = rawInput;
    this.auth = auth;
  }

  public String getRawInput() {
    return rawInput;
  }

  public AuthContext getAuth() {
    return auth;
  }

  public String getProcessedInput() {
    return processedInput;
  }

  public void setProcessedInput(String processedInput) {
    this.processedInput = processedInput;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
