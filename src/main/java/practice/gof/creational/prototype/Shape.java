package practice.gof.creational.prototype;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

abstract class Shape {
  private int x;
  private int y;
  private String color;
  private final List<String> tags;

  protected Shape(int x, int y, String color) {
    this.x = x;
    this.y = y;
    this.color = color;
    this.tags = new ArrayList<>();
  }

  // copy constructor: the tag list is copied, not shared
  protected Shape(Shape source) {
    this.x = source.x;
    this.y = source.y;
    this.color = source.color;
    this.tags = new ArrayList<>(source.tags);
  }

  abstract Shape copy();

  abstract double area();

  final void moveTo(int x, int y) {
    this.x = x;
    this.y = y;
  }

  final void paint(String color) {
    this.color = color;
  }

  final void tag(String tag) {
    tags.add(tag);
  }

  final int x() {
    return x;
  }

  final int y() {
    return y;
  }

  final String color() {
    return color;
  }

  final List<String> tags() {
    return List.copyOf(tags);
  }

  String describe() {
    return getClass().getSimpleName()
        + "{x="
        + x
        + ", y="
        + y
        + ", color="
        + color
        + ", tags="
        + tags
        + ", area="
        + String.format(Locale.ROOT, "%.2f", area())
        + "}";
  }
}
