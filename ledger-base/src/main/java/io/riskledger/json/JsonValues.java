/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.json;


import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Opaque JSON values (payloads, policies, permissions, attachments).
 *
 * <h2>Value Model</h2>
 * <p>
 * A JSON value is one of {@code null}, {@linkplain Boolean}, {@linkplain Long},
 * {@linkplain Double}, {@linkplain String}, {@linkplain JSONArray}, or
 * {@linkplain JSONObject}: the types json-simple's parser produces. Values
 * handed in by users may be any {@linkplain Map} (with string keys),
 * {@linkplain Collection}, {@linkplain Number}, etc.; they are brought into
 * the above form with {@linkplain #normalize(Object)}, which is a
 * write-then-parse round trip. Since the ledger hashes what it stores, and
 * stores JSON text, a value must hash the same before and after it makes
 * that trip.
 * </p>
 */
public class JsonValues {

  // no one calls
  private JsonValues() {  }


  /**
   * Returns the normalized form of the given value, i.e. the value
   * json-simple parses back from its JSON text.
   *
   * @param value {@code null}, or composed of maps, collections, strings,
   *              finite numbers, and booleans
   *
   * @throws IllegalArgumentException
   *         if {@code value} (at any depth) is not JSON-expressible
   */
  public static Object normalize(Object value) throws IllegalArgumentException {
    if (value == null)
      return null;
    return parse(toJson(value));
  }


  /**
   * Returns the JSON text for the given value.
   *
   * @throws IllegalArgumentException
   *         if {@code value} (at any depth) is not JSON-expressible
   */
  public static String toJson(Object value) throws IllegalArgumentException {
    return JSONValue.toJSONString(toTree(value, "$"));
  }


  /**
   * Parses and returns the given JSON text. {@code null} and blank strings
   * parse to {@code null}.
   *
   * @throws JsonParsingException if {@code json} is malformed
   */
  public static Object parse(String json) throws JsonParsingException {
    if (json == null || json.isBlank())
      return null;
    try {
      return new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + px, px);
    }
  }


  /**
   * Parses the given text as a JSON array of strings. {@code null} and blank
   * strings parse to the empty list.
   *
   * @return immutable list
   */
  public static List<String> parseStringList(String json) throws JsonParsingException {
    Object value = parse(json);
    if (value == null)
      return List.of();
    if (!(value instanceof JSONArray jArray))
      throw new JsonParsingException("expected JSON array of strings: " + json);
    List<String> strings = new ArrayList<>(jArray.size());
    for (Object e : jArray) {
      if (!(e instanceof String s))
        throw new JsonParsingException("expected string element: " + e);
      strings.add(s);
    }
    return Collections.unmodifiableList(strings);
  }


  /**
   * Copies the given value into a tree of {@linkplain JSONObject}s and
   * {@linkplain JSONArray}s (leaves are shared), checking types as it goes.
   *
   * @param path  JSON-path like location, for error messages
   */
  @SuppressWarnings("unchecked")
  private static Object toTree(Object value, String path) {
    if (value == null ||
        value instanceof String ||
        value instanceof Boolean ||
        value instanceof Long ||
        value instanceof Integer ||
        value instanceof Short ||
        value instanceof Byte)
      return value;

    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d))
        throw new IllegalArgumentException(
            "non-finite number at %s: %s".formatted(path, value));
      return value;
    }
    if (value instanceof BigInteger big) {
      if (big.bitLength() > 63)
        throw new IllegalArgumentException(
            "integer out of range at %s: %s".formatted(path, value));
      return big.longValue();
    }
    if (value instanceof BigDecimal dec) {
      double d = dec.doubleValue();
      if (!Double.isFinite(d))
        throw new IllegalArgumentException(
            "number out of range at %s: %s".formatted(path, value));
      return d;
    }
    if (value instanceof Map<?, ?> map) {
      JSONObject jObj = new JSONObject();
      for (var e : map.entrySet()) {
        if (!(e.getKey() instanceof String key))
          throw new IllegalArgumentException(
              "non-string key at %s: %s".formatted(path, e.getKey()));
        jObj.put(key, toTree(e.getValue(), path + "." + key));
      }
      return jObj;
    }
    if (value instanceof Collection<?> col) {
      JSONArray jArray = new JSONArray();
      int index = 0;
      for (Object e : col)
        jArray.add(toTree(e, path + "[" + (index++) + "]"));
      return jArray;
    }
    throw new IllegalArgumentException(
        "unsupported JSON type at %s: %s".formatted(path, value.getClass().getName()));
  }

}
