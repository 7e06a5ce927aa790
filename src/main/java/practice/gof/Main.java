package practice.gof;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {
  static final String USAGE = "usage: Main [--list | --markdown | <pattern>...]";

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Returns the process exit status: 0 on success, 1 when a pattern name is not known. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 1 && args[0].equals("--list")) {
      for (Pattern pattern : Pattern.values()) {
        out.println(
            pattern.slug()
                + "  - "
                + pattern.displayName()
                + " ("
                + pattern.category().title()
                + ")");
      }
      return 0;
    }
    if (args.length == 1 && args[0].equals("--markdown")) {
      out.print(MarkdownCatalog.render());
      return 0;
    }

    List<Pattern> selected;
    try {
      selected = select(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 1;
    }

    boolean first = true;
    for (Pattern pattern : selected) {
      if (!first) {
        out.println();
      }
      first = false;
      out.println("=== " + pattern.displayName() + " ===");
      pattern.runDemo(out);
    }
    return 0;
  }

  static List<Pattern> select(String... names) {
    if (names.length == 0) {
      return Arrays.asList(Pattern.values());
    }
    List<Pattern> selected = new ArrayList<>();
    for (String name : names) {
      selected.add(Pattern.fromName(name));
    }
    return selected;
  }
}
