package practice.gof.creational.factorymethod;

final class RoadLogistics extends Logistics {
  @Override
  Transport createTransport() {
    return new Truck();
  }
}
