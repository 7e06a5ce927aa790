package practice.gof.structural.decorator;

final class WhippedCream extends CoffeeDecorator {
  WhippedCream(Coffee wrapped) {
    super(wrapped);
  }

  @Override
  long extraCost() {
    return 80;
  }

  @Override
  String extraName() {
    return "Whipped cream";
  }
}
