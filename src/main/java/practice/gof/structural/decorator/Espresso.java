package practice.gof.structural.decorator;

final class Espresso implements Coffee {
  @Override
  public long cost() {
    return 300;
  }

  @Override
  public String description() {
    return "Espresso";
  }
}
