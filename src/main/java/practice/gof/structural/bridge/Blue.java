package practice.gof.structural.bridge;

final class Blue implements Color {
  @Override
  public String name() {
    return "Blue";
  }
}
