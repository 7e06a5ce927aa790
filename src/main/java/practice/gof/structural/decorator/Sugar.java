package practice.gof.structural.decorator;

final class Sugar extends CoffeeDecorator {
  Sugar(Coffee wrapped) {
    super(wrapped);
  }

  @Override
  long extraCost() {
    return 10;
  }

  @Override
  String extraName() {
    return "Sugar";
  }
}
