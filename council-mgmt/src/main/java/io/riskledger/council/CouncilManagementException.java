/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * Exception thrown by this module on persistence failures. The operation
 * that failed had no effect (its transaction was rolled back) and may be
 * retried. The underlying {@linkplain java.sql.SQLException}, if any, is
 * the cause.
 */
@SuppressWarnings("serial")
public class CouncilManagementException extends RuntimeException {

  public CouncilManagementException() {
  }

  public CouncilManagementException(String message) {
    super(message);
  }

  public CouncilManagementException(Throwable cause) {
    this("internal error caused by: " + cause, cause);
  }

  public CouncilManagementException(String message, Throwable cause) {
    super(message, cause);
  }

}
