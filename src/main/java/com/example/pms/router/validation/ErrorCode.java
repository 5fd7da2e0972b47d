package com.example.pms.router.validation;

/** Error taxonomy shared by request-path and worker components. */
public enum ErrorCode {
  CLASSIFICATION_AMBIGUOUS,
  EXTRACTION_TIMEOUT,
  UNKNOWN_ENTITY,
  EMBEDDING_UNAVAILABLE,
  REFRESH_TRANSIENT_FAILURE,
  REFRESH_PERMANENT_FAILURE,
  CIRCUIT_OPEN,
  MISSING_TENANT,
  INVALID_REQUEST
}
