package com.paperdex.app.cli;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Parsed command line: command, its positional arguments and {@code --limit}.
 *
 * <p>Options other than {@code --limit} belong to Spring ({@code --server.port=...},
 * {@code --paperindex.table-name=...}) and are skipped here.
 */
@Value
public class CommandLineArgs {

  private static final String LIMIT_OPTION = "--limit";

  PaperCommand command;

  List<String> arguments;

  /** {@code null} when not given. */
  Integer limit;

  /** True when {@code args} carry a positional argument, i.e. the process runs as a CLI. */
  public static boolean hasCommand(String[] args) {
    return !positionals(args).isEmpty();
  }

  /**
   * @throws UsageException if the command is unknown, the arity is wrong or the limit is invalid
   */
  public static CommandLineArgs parse(String[] args) {
    List<String> positionals = positionals(args);
    if (positionals.isEmpty()) {
      throw new UsageException("missing command");
    }
    String name = positionals.get(0);
    PaperCommand command =
        PaperCommand.named(name).orElseThrow(() -> new UsageException("unknown command: " + name));
    List<String> arguments = List.copyOf(positionals.subList(1, positionals.size()));
    if (arguments.size() != command.arity()) {
      throw new UsageException(
          "expected " + command.arity() + " argument(s) for " + name + ": " + command.usage());
    }

    String rawLimit = limitValue(args);
    Integer limit = null;
    if (rawLimit != null) {
      if (!command.acceptsLimit()) {
        throw new UsageException(name + " does not take --limit");
      }
      try {
        limit = Integer.parseInt(rawLimit);
      } catch (NumberFormatException e) {
        throw new UsageException("invalid limit: " + rawLimit);
      }
      if (limit < 1) {
        throw new UsageException("invalid limit: " + rawLimit);
      }
    }
    return new CommandLineArgs(command, arguments, limit);
  }

  private static List<String> positionals(String[] args) {
    List<String> positionals = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.equals(LIMIT_OPTION)) {
        i++; // value follows
      } else if (!arg.startsWith("--")) {
        positionals.add(arg);
      }
    }
    return positionals;
  }

  private static String limitValue(String[] args) {
    String value = null;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.equals(LIMIT_OPTION)) {
        if (i + 1 >= args.length) {
          throw new UsageException("--limit needs a value");
        }
        value = args[++i];
      } else if (arg.startsWith(LIMIT_OPTION + "=")) {
        value = arg.substring(LIMIT_OPTION.length() + 1);
      }
    }
    return value;
  }
}
