package practice.gof.creational.abstractfactory;

interface Checkbox {
  Theme theme();

  String render(String label, boolean checked);
}
