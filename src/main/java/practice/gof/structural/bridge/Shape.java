package practice.gof.structural.bridge;

import java.util.Objects;

abstract class Shape {
  protected final Color color;

  protected Shape(Color color) {
    this.color = Objects.requireNonNull(color, "color");
  }

  abstract String kind();

  final String describe() {
    return color.name() + " " + kind();
  }
}
