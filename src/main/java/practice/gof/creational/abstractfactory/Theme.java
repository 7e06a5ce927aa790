package practice.gof.creational.abstractfactory;

enum Theme {
  LIGHT,
  DARK
}
