/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.NoSuchElementException;

/**
 * Thrown when an operation requires the assessment be assigned to a council,
 * but it isn't.
 */
@SuppressWarnings("serial")
public class UnassignedAssessmentException extends NoSuchElementException {

  private final String assessmentId;

  public UnassignedAssessmentException(String assessmentId) {
    super("assessment '%s' not assigned to council".formatted(assessmentId));
    this.assessmentId = assessmentId;
  }

  /** Returns the assessment's id. */
  public String assessmentId() {
    return assessmentId;
  }

}
