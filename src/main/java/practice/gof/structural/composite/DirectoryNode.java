package practice.gof.structural.composite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

final class DirectoryNode implements Node {
  private static final String INDENT = "  ";

  private final String name;
  private final List<Node> children = new ArrayList<>();

  DirectoryNode(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  DirectoryNode add(Node child) {
    Objects.requireNonNull(child, "child");
    if (child == this) {
      throw new IllegalArgumentException("a directory cannot contain itself");
    }
    if (child instanceof DirectoryNode && ((DirectoryNode) child).contains(this)) {
      throw new IllegalArgumentException(
          "adding " + child.name() + " to " + name + " would create a cycle");
    }
    children.add(child);
    return this;
  }

  // true if target is somewhere below this directory
  boolean contains(Node target) {
    for (Node child : children) {
      if (child == target) {
        return true;
      }
      if (child instanceof DirectoryNode && ((DirectoryNode) child).contains(target)) {
        return true;
      }
    }
    return false;
  }

  boolean remove(Node child) {
    return children.remove(child);
  }

  List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public long size() {
    long total = 0;
    for (Node child : children) {
      total += child.size();
    }
    return total;
  }

  @Override
  public List<String> render() {
    List<String> lines = new ArrayList<>();
    lines.add(name + "/ (" + size() + ")");
    for (Node child : children) {
      for (String line : child.render()) {
        lines.add(INDENT + line);
      }
    }
    return lines;
  }
}
