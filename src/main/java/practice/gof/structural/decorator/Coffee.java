package practice.gof.structural.decorator;

interface Coffee {
  // yen
  long cost();

  String description();
}
