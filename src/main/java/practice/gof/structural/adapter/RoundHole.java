package practice.gof.structural.adapter;

final class RoundHole {
  private final double radius;

  RoundHole(double radius) {
    this.radius = radius;
  }

  double radius() {
    return radius;
  }

  boolean fits(RoundPeg peg) {
    return peg.radius() <= radius;
  }
}
