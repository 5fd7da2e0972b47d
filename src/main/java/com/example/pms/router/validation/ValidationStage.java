package com.example.pms.router.validation;

/** Identifies where in the routing pipeline a validator is executed. */
public enum ValidationStage {
  /** Checks on the caller context; run first. */
  REQUEST,
  /** Normalization of the query text before classification. */
  INPUT
}
