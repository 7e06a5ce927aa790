package practice.gof.creational.abstractfactory;

interface Button {
  Theme theme();

  String render(String label);
}
