package com.paperdex.app.service;

/** A source record that cannot be turned into keyed items. */
public class InvalidPaperException extends RuntimeException {

  public InvalidPaperException(String message) {
    super(message);
  }
}
