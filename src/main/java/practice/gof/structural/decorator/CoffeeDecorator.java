package practice.gof.structural.decorator;

import java.util.Objects;

abstract class CoffeeDecorator implements Coffee {
  private final Coffee wrapped;

  protected CoffeeDecorator(Coffee wrapped) {
    this.wrapped = Objects.requireNonNull(wrapped, "wrapped");
  }

  abstract long extraCost();

  abstract String extraName();

  @Override
  public final long cost() {
    return wrapped.cost() + extraCost();
  }

  @Override
  public final String description() {
    return wrapped.description() + ", " + extraName();
  }
}
