package practice.gof.structural.bridge;

final class Red implements Color {
  @Override
  public String name() {
    return "Red";
  }
}
