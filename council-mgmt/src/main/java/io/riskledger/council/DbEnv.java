/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.Objects;

/**
 * Encapsulates database conventions and the context (permissions) instances
 * of the system operate in.
 *
 * @param tablePrefix   system table-name prefix
 * @param readOnly      if {@code true}, then write operations are not supported
 */
public record DbEnv(String tablePrefix, boolean readOnly) {


  /** Read-only instance with the default table prefix. */
  public final static DbEnv DEFAULT = new DbEnv();


  public DbEnv {
    tablePrefix = tablePrefix.trim();
    for (int index = tablePrefix.length(); index-- > 0; ) {
      char c = tablePrefix.charAt(index);
      if (!(Character.isLetterOrDigit(c) || c == '_'))
        throw new IllegalArgumentException(
            "illegal char '%c' in table prefix '%s'".formatted(c, tablePrefix));
    }
  }


  /**
   * The default instance is read-only.
   *
   * @see CouncilConstants#DEFAULT_PREFIX
   */
  public DbEnv() {
    this(CouncilConstants.DEFAULT_PREFIX, true);
  }


  /**
   * Sets the property and returns a new instance, if changed.
   */
  public DbEnv readOnly(boolean readOnly) {
    if (this.readOnly == readOnly)
      return this;
    return new DbEnv(tablePrefix, readOnly);
  }


  /**
   * Returns {@code true} if in read/write mode.
   *
   * @return {@code !readOnly()}
   */
  public boolean readWrite() {
    return !readOnly;
  }

  /**
   * Sets the property and returns a new instance, if changed.
   */
  public DbEnv readWrite(boolean write) {
    return readOnly(!write);
  }


  /**
   * Sets the property and returns a new instance, if changed.
   */
  public DbEnv tablePrefix(String tablePrefix) {
    if (this.tablePrefix.equals(tablePrefix))
      return this;
    return new DbEnv(tablePrefix, readOnly);
  }


  /**
   * Applies table-prefix substitutions encoded as {@code "%s"} in the given
   * (assumed SQL) string and returns it.
   */
  public String applyTablePrefix(String sql) {
    return applyWildCard(sql, tablePrefix);
  }


  public String applyWildCard(String sql, String wildCardValue) {

    Objects.requireNonNull(wildCardValue, "null wildCardValue");
    int substitutions = 0;

    for (int index = sql.indexOf("%s"); index != -1; index = sql.indexOf("%s", index + 2))
      ++substitutions;

    if (substitutions == 0)
      return sql;

    Object[] fArgs = new Object[substitutions];
    for (int index = fArgs.length; index-- > 0; )
      fArgs[index] = wildCardValue;

    return sql.formatted(fArgs);
  }

}
