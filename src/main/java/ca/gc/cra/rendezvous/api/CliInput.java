package ca.gc.cra.rendezvous.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and key/value pairs.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments; tokens starting with {@code -} and lacking {@code =} are flags, the rest are key/value
   * pairs or the subcommand.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(positional.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns a copy of the non-flag arguments in their original order.
   *
   * @return key/value arguments, possibly led by a subcommand
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags other than help and verbose that no command recognises.
   *
   * @param known flags the caller understands
   * @return unrecognised flags in input order
   */
  public List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !known.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
