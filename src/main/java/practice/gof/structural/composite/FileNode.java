package practice.gof.structural.composite;

import java.util.List;
import java.util.Objects;

final class FileNode implements Node {
  private final String name;
  private final long size;

  FileNode(String name, long size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must not be negative: " + size);
    }
    this.name = Objects.requireNonNull(name, "name");
    this.size = size;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public List<String> render() {
    return List.of(name + " (" + size + ")");
  }
}
