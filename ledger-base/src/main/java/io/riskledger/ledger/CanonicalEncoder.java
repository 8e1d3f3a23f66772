/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic binary encoding of JSON-like value trees, used as the
 * preimage of ledger entry hashes.
 *
 * <h2>Format</h2>
 * <p>
 * The encoding begins with a single {@linkplain #FORMAT_VERSION} byte,
 * followed by the encoded root value. Every value begins with a 1-byte
 * type tag:
 * </p>
 * <ul>
 * <li>{@code 'n'} null</li>
 * <li>{@code 't'}, {@code 'f'} true, false</li>
 * <li>{@code 'i'} integer: 8 bytes, big endian</li>
 * <li>{@code 'd'} decimal: 8 byte IEEE 754 bits, big endian (finite only)</li>
 * <li>{@code 's'} string: 4 byte length, followed by that many UTF-8 bytes</li>
 * <li>{@code 'a'} array: 4 byte element count, followed by the elements</li>
 * <li>{@code 'o'} object: 4 byte entry count, followed by key/value pairs
 *     in ascending key order; each key is encoded as a string value</li>
 * </ul>
 * <p>
 * Since every composite is count-prefixed and every scalar is tagged, and
 * object keys are sorted at every depth, two trees have the same encoding
 * iff they are logically equal. Nothing is filtered: the whole tree is
 * written.
 * </p>
 */
public final class CanonicalEncoder {

  // no one calls
  private CanonicalEncoder() {  }


  public final static byte FORMAT_VERSION = 1;

  public final static byte NULL_TAG = 'n';
  public final static byte TRUE_TAG = 't';
  public final static byte FALSE_TAG = 'f';
  public final static byte INT_TAG = 'i';
  public final static byte DECIMAL_TAG = 'd';
  public final static byte STRING_TAG = 's';
  public final static byte ARRAY_TAG = 'a';
  public final static byte OBJECT_TAG = 'o';


  /**
   * Encodes and returns the given value tree.
   *
   * @param value {@code null}, or a tree of maps (string keys), collections,
   *              strings, finite numbers and booleans
   *
   * @throws IllegalArgumentException
   *         if any node in the tree is not of a supported type
   */
  public static byte[] encode(Object value) throws IllegalArgumentException {
    var out = new ByteArrayOutputStream(256);
    out.write(FORMAT_VERSION);
    encodeValue(value, out);
    return out.toByteArray();
  }


  private static void encodeValue(Object value, ByteArrayOutputStream out) {

    if (value == null)
      out.write(NULL_TAG);

    else if (value instanceof Boolean bool)
      out.write(bool ? TRUE_TAG : FALSE_TAG);

    else if (value instanceof String s)
      writeString(s, out);

    else if (value instanceof Number num)
      writeNumber(num, out);

    else if (value instanceof Map<?, ?> map)
      writeObject(map, out);

    else if (value instanceof Collection<?> col) {
      out.write(ARRAY_TAG);
      writeInt(col.size(), out);
      for (Object e : col)
        encodeValue(e, out);

    } else
      throw new IllegalArgumentException(
          "unsupported type: " + value.getClass().getName());
  }


  private static void writeNumber(Number num, ByteArrayOutputStream out) {
    if (num instanceof Long ||
        num instanceof Integer ||
        num instanceof Short ||
        num instanceof Byte) {

      out.write(INT_TAG);
      writeLong(num.longValue(), out);

    } else if (num instanceof BigInteger big && big.bitLength() <= 63) {

      out.write(INT_TAG);
      writeLong(big.longValue(), out);

    } else {
      double d = num instanceof BigDecimal dec ? dec.doubleValue() : num.doubleValue();
      if (!Double.isFinite(d))
        throw new IllegalArgumentException("non-finite number: " + num);
      out.write(DECIMAL_TAG);
      writeLong(Double.doubleToLongBits(d), out);
    }
  }


  private static void writeObject(Map<?, ?> map, ByteArrayOutputStream out) {
    TreeMap<String, Object> sorted = new TreeMap<>();
    for (var e : map.entrySet()) {
      if (!(e.getKey() instanceof String key))
        throw new IllegalArgumentException("non-string key: " + e.getKey());
      sorted.put(key, e.getValue());
    }
    out.write(OBJECT_TAG);
    writeInt(sorted.size(), out);
    for (var e : sorted.entrySet()) {
      writeString(e.getKey(), out);
      encodeValue(e.getValue(), out);
    }
  }


  private static void writeString(String s, ByteArrayOutputStream out) {
    byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
    out.write(STRING_TAG);
    writeInt(utf8.length, out);
    out.write(utf8, 0, utf8.length);
  }


  private static void writeInt(int value, ByteArrayOutputStream out) {
    out.write(value >>> 24);
    out.write(value >>> 16);
    out.write(value >>> 8);
    out.write(value);
  }


  private static void writeLong(long value, ByteArrayOutputStream out) {
    writeInt((int) (value >>> 32), out);
    writeInt((int) value, out);
  }

}
