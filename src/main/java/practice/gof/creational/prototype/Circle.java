package practice.gof.creational.prototype;

final class Circle extends Shape {
  private final int radius;

  Circle(int x, int y, String color, int radius) {
    super(x, y, color);
    this.radius = radius;
  }

  private Circle(Circle source) {
    super(source);
    this.radius = source.radius;
  }

  int radius() {
    return radius;
  }

  @Override
  Circle copy() {
    return new Circle(this);
  }

  @Override
  double area() {
    return Math.PI * radius * radius;
  }
}
