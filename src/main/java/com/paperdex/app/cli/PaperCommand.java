package com.paperdex.app.cli;

import java.util.Arrays;
import java.util.Optional;

/** Sub-commands understood on the command line. */
public enum PaperCommand {
  LOAD("load", "load <papers_json_path>", 1, false),
  RECENT("recent", "recent <category> [--limit N]", 1, true),
  AUTHOR("author", "author <author_name>", 1, false),
  GET("get", "get <arxiv_id>", 1, false),
  DATERANGE("daterange", "daterange <category> <start_date> <end_date>", 3, false),
  KEYWORD("keyword", "keyword <keyword> [--limit N]", 1, true);

  private final String name;
  private final String usage;
  private final int arity;
  private final boolean acceptsLimit;

  PaperCommand(String name, String usage, int arity, boolean acceptsLimit) {
    this.name = name;
    this.usage = usage;
    this.arity = arity;
    this.acceptsLimit = acceptsLimit;
  }

  public String commandName() {
    return name;
  }

  public String usage() {
    return usage;
  }

  /** Number of positional arguments after the command name. */
  public int arity() {
    return arity;
  }

  public boolean acceptsLimit() {
    return acceptsLimit;
  }

  public static Optional<PaperCommand> named(String name) {
    return Arrays.stream(values()).filter(c -> c.name.equals(name)).findFirst();
  }

  /** Multi-line usage text covering every command. */
  public static String usageText() {
    StringBuilder sb = new StringBuilder("usage:");
    for (PaperCommand c : values()) {
      sb.append(System.lineSeparator()).append("  ").append(c.usage);
    }
    return sb.toString();
  }
}
