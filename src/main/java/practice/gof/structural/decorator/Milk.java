package practice.gof.structural.decorator;

final class Milk extends CoffeeDecorator {
  Milk(Coffee wrapped) {
    super(wrapped);
  }

  @Override
  long extraCost() {
    return 50;
  }

  @Override
  String extraName() {
    return "Milk";
  }
}
