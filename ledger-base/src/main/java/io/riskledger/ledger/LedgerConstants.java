/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.lang.System.Logger;

/**
 * Module constants.
 */
public class LedgerConstants {

  // no one calls
  private LedgerConstants() {  }


  public final static String LOG_NAME = "riskledger.ledger";

  /** Entry hashes are SHA-256. */
  public final static String HASH_ALGO = "SHA-256";

  /** Width of a raw hash in bytes. */
  public final static int HASH_WIDTH = 32;

  /** Width of a hex-encoded hash in characters. */
  public final static int HEX_HASH_WIDTH = 2 * HASH_WIDTH;


  /**
   * Stand-in for the expected previous hash of the first entry in
   * {@linkplain VerificationResult}s.
   */
  public final static String NULL_HASH = "null";


  static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }

}
