package com.paperdex.app.cli;

/** Command-line input that does not match any command's usage. */
public class UsageException extends IllegalArgumentException {

  public UsageException(String message) {
    super(message);
  }
}
