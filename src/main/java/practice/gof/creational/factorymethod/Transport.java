package practice.gof.creational.factorymethod;

interface Transport {
  String deliver(String cargo);
}
