package practice.gof.structural.proxy;

import java.util.Objects;

// loading happens in the constructor, which is the expensive part
final class HighResolutionImage implements Image {
  private final String fileName;
  private final String pixels;

  HighResolutionImage(String fileName) {
    this.fileName = Objects.requireNonNull(fileName, "fileName");
    this.pixels = loadFromDisk(fileName);
  }

  private static String loadFromDisk(String fileName) {
    return "pixels of " + fileName;
  }

  @Override
  public String fileName() {
    return fileName;
  }

  @Override
  public String display() {
    return "Displaying " + fileName + " (" + pixels + ")";
  }
}
