package practice.gof.structural.composite;

import java.io.PrintStream;

public final class CompositeDemo {
  public static void run(PrintStream out) {
    DirectoryNode docs =
        new DirectoryNode("docs")
            .add(new FileNode("readme.md", 120))
            .add(new FileNode("guide.md", 480));
    DirectoryNode src = new DirectoryNode("src").add(new FileNode("Main.java", 900));
    DirectoryNode root =
        new DirectoryNode("project").add(docs).add(src).add(new FileNode("pom.xml", 300));

    for (String line : root.render()) {
      out.println(line);
    }
    out.println("leaf and composite share one interface: total=" + root.size());
  }

  private CompositeDemo() {}
}
