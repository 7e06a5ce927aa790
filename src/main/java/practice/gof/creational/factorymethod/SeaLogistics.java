package practice.gof.creational.factorymethod;

final class SeaLogistics extends Logistics {
  @Override
  Transport createTransport() {
    return new Ship();
  }
}
