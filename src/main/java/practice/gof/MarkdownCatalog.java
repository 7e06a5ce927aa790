package practice.gof;

import java.util.ArrayList;
import java.util.List;

/** Renders the catalogue as a markdown document, one section per pattern. */
public final class MarkdownCatalog {
  static final String TITLE = "# Design Patterns";
  private static final String FENCE = "```";

  /**
   * Runs every demo to fill the code blocks. The Singleton section shows serial numbers from the
   * shared sequence, so they advance on each call; every other section renders the same each time.
   */
  public static String render() {
    StringBuilder markdown = new StringBuilder();
    markdown.append(TITLE).append("\n");
    for (Category category : Category.values()) {
      markdown.append("\n## ").append(category.title()).append("\n");
      for (Pattern pattern : Pattern.byCategory(category)) {
        markdown.append("\n").append(heading(pattern)).append("\n\n");
        markdown.append(pattern.overview()).append("\n\n");
        markdown.append(FENCE).append("text\n");
        String output = pattern.demoOutput();
        markdown.append(output);
        if (!output.endsWith("\n")) {
          markdown.append("\n");
        }
        markdown.append(FENCE).append("\n");
      }
    }
    return markdown.toString();
  }

  /** Names of the patterns whose heading, overview or code block is absent from the document. */
  public static List<String> missingSections(String markdown) {
    List<String> missing = new ArrayList<>();
    for (Pattern pattern : Pattern.values()) {
      String heading = heading(pattern);
      int start = markdown.indexOf(heading + "\n");
      if (start < 0) {
        missing.add(pattern.displayName());
        continue;
      }
      int end = markdown.indexOf("\n#", start + heading.length());
      String section = end < 0 ? markdown.substring(start) : markdown.substring(start, end);
      if (!section.contains(pattern.overview()) || !containsCodeBlock(section)) {
        missing.add(pattern.displayName());
      }
    }
    return missing;
  }

  private static boolean containsCodeBlock(String section) {
    int open = section.indexOf(FENCE);
    return open >= 0 && section.indexOf(FENCE, open + FENCE.length()) > open;
  }

  private static String heading(Pattern pattern) {
    return "### " + pattern.displayName();
  }

  private MarkdownCatalog() {}
}
