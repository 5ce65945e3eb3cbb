package com.paperdex.app.api;

/** A request the read API refuses before touching the store; answered with 400. */
public class InvalidQueryException extends RuntimeException {

  public InvalidQueryException(String reason) {
    super(reason);
  }
}
