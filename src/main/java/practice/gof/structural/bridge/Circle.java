package practice.gof.structural.bridge;

final class Circle extends Shape {
  Circle(Color color) {
    super(color);
  }

  @Override
  String kind() {
    return "Circle";
  }
}
