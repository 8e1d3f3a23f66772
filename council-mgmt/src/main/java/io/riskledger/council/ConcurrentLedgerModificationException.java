/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


/**
 * Indicates an evidence-ledger append lost a race: either the chain head
 * could not be locked in time, or a concurrent append claimed the same
 * position in the chain. Nothing was written; the operation may be retried.
 */
@SuppressWarnings("serial")
public class ConcurrentLedgerModificationException extends CouncilManagementException {

  public ConcurrentLedgerModificationException() {
  }

  public ConcurrentLedgerModificationException(String message) {
    super(message);
  }

  public ConcurrentLedgerModificationException(Throwable cause) {
    super(cause);
  }

  public ConcurrentLedgerModificationException(String message, Throwable cause) {
    super(message, cause);
  }

}
