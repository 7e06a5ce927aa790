package practice.gof.structural.proxy;

import java.util.Objects;
import java.util.function.Function;

/** Stands in for an {@link Image} and loads the real one on the first {@link #display()}. */
final class LazyImageProxy implements Image {
  private final String fileName;
  private final Function<String, Image> loader;
  private Image realImage;

  LazyImageProxy(String fileName) {
    this(fileName, HighResolutionImage::new);
  }

  LazyImageProxy(String fileName, Function<String, Image> loader) {
    this.fileName = Objects.requireNonNull(fileName, "fileName");
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  @Override
  public String fileName() {
    return fileName;
  }

  @Override
  public String display() {
    if (realImage == null) {
      realImage = loader.apply(fileName);
    }
    return realImage.display();
  }

  boolean isLoaded() {
    return realImage != null;
  }
}
