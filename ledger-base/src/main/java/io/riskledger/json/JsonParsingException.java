/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.json;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException() {
  }

  public JsonParsingException(String s) {
    super(s);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
