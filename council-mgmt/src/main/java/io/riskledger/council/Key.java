/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

import java.util.Comparator;

/**
 * Typed values used as keys in the database.
 *
 * <h2>Purpose</h2>
 * <p>
 * This library does not use an ORM: it manages its relational tables
 * directly through its "table-managers" ({@linkplain CouncilMgr},
 * {@linkplain MembershipMgr}, etc.). A primary key read by one manager is
 * often a downstream argument to another. Since only this package's managers
 * instantiate key sub-types (from values read from the database), a manager
 * that takes a key as argument need not verify it comes from the purported
 * table.
 * </p>
 * <p>
 * All primary keys are {@code BIGINT}s, encapsulated as
 * {@linkplain LongKey}. Zero is never a database key: it's the value of the
 * sentinel "not set" keys of "args"-instances.
 * </p>
 */
public class Key {

  private Key() { }


  /**
   * Long-based key. Subclasses <em>must</em> override {@code Object.equals}.
   */
  public static abstract class LongKey extends Key {

    public final static Comparator<LongKey> COMPARATOR =
        (a, b) -> Long.compare(a.no, b.no);

    private final long no;

    LongKey(long no) {
      if (no < 0)
        throw new IllegalArgumentException("negative key: " + no);
      this.no = no;
    }

    /** @return {@code Long.hashCode(no())} */
    @Override
    public final int hashCode() {
      return Long.hashCode(no);
    }

    /** Returns the key's number. */
    public final long no() {
      return no;
    }

    /**
     * Returns {@code true}, if this value came from the database.
     */
    public final boolean isSet() {
      return no != 0;
    }

    /** @return {@linkplain #no()} as a string. */
    @Override
    public String toString() {
      return Long.toString(no);
    }
  }

}
