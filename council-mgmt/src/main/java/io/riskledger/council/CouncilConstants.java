/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.lang.System.Logger;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Module constants and package-private helper methods.
 */
public class CouncilConstants {

  // no one calls
  private CouncilConstants() {  }


  /**
   * By default, system table names begin with this prefix.
   */
  public final static String DEFAULT_PREFIX = "rc_";


  public final static String LOG_NAME = "riskledger.council";


  /** Actor role recorded for ledger entries the system itself appends. */
  public final static String SYSTEM_ROLE = "SYSTEM";


  /** Maximum length of names, user ids, and other short strings. */
  public final static int MAX_ID_LENGTH = 255;

  /** Maximum length of descriptions and notes. */
  public final static int MAX_TEXT_LENGTH = 4096;


  /** Default page size for listings. */
  public final static int DEFAULT_LIMIT = 50;

  /** Maximum page size for listings. */
  public final static int MAX_LIMIT = 100;


  static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }


  static Optional<String> normalize(Optional<String> arg) {
    if (arg == null)
      return Optional.empty();
    return arg.map(String::trim).filter(Predicate.not(String::isBlank));
  }


  static Optional<String> normalize(String arg) {
    return normalize(Optional.ofNullable(arg));
  }


  /**
   * Trims and returns the given required string argument.
   *
   * @throws IllegalArgumentException
   *         if {@code null}, blank, or longer than {@code maxLength}
   */
  static String checkText(String value, String name, int maxLength)
      throws IllegalArgumentException {
    if (value == null)
      throw new IllegalArgumentException("missing " + name);
    value = value.trim();
    if (value.isEmpty())
      throw new IllegalArgumentException("blank " + name);
    checkLength(value, name, maxLength);
    return value;
  }


  /**
   * Normalizes and returns the given optional string argument.
   *
   * @throws IllegalArgumentException if longer than {@code maxLength}
   */
  static Optional<String> checkText(
      Optional<String> value, String name, int maxLength)
          throws IllegalArgumentException {
    value = normalize(value);
    if (value.isPresent())
      checkLength(value.get(), name, maxLength);
    return value;
  }


  private static void checkLength(String value, String name, int maxLength) {
    if (value.length() > maxLength)
      throw new IllegalArgumentException(
          "%s too long (%d > %d chars)".formatted(name, value.length(), maxLength));
  }


  /**
   * Checks the page-size argument.
   *
   * @throws IllegalArgumentException
   *         if not in the range [1, {@linkplain #MAX_LIMIT}]
   */
  static int checkLimit(int limit) throws IllegalArgumentException {
    if (limit < 1 || limit > MAX_LIMIT)
      throw new IllegalArgumentException(
          "limit %d out of bounds [1, %d]".formatted(limit, MAX_LIMIT));
    return limit;
  }

}
