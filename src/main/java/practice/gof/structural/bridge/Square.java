package practice.gof.structural.bridge;

final class Square extends Shape {
  Square(Color color) {
    super(color);
  }

  @Override
  String kind() {
    return "Square";
  }
}
