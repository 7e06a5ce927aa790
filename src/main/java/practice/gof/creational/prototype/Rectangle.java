package practice.gof.creational.prototype;

final class Rectangle extends Shape {
  private final int width;
  private final int height;

  Rectangle(int x, int y, String color, int width, int height) {
    super(x, y, color);
    this.width = width;
    this.height = height;
  }

  private Rectangle(Rectangle source) {
    super(source);
    this.width = source.width;
    this.height = source.height;
  }

  int width() {
    return width;
  }

  int height() {
    return height;
  }

  @Override
  Rectangle copy() {
    return new Rectangle(this);
  }

  @Override
  double area() {
    return (double) width * height;
  }
}
