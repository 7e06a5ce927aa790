package practice.gof.structural.adapter;

import java.util.Objects;

/** Presents a square peg as the smallest round peg that encloses it. */
final class SquarePegAdapter implements RoundPeg {
  private final SquarePeg peg;

  SquarePegAdapter(SquarePeg peg) {
    this.peg = Objects.requireNonNull(peg, "peg");
  }

  @Override
  public double radius() {
    return peg.width() * Math.sqrt(2) / 2;
  }
}
