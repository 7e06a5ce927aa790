package practice.gof.structural.adapter;

// incompatible with RoundHole: has a width, not a radius
final class SquarePeg {
  private final double width;

  SquarePeg(double width) {
    this.width = width;
  }

  double width() {
    return width;
  }
}
