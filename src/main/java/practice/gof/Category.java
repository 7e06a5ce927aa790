package practice.gof;

public enum Category {
  CREATIONAL("Creational patterns"),
  STRUCTURAL("Structural patterns");

  private final String title;

  Category(String title) {
    this.title = title;
  }

  public String title() {
    return title;
  }
}
