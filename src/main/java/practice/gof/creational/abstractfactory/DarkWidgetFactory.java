package practice.gof.creational.abstractfactory;

final class DarkWidgetFactory implements WidgetFactory {
  @Override
  public Button createButton() {
    return new DarkButton();
  }

  @Override
  public Checkbox createCheckbox() {
    return new DarkCheckbox();
  }

  private static final class DarkButton implements Button {
    @Override
    public Theme theme() {
      return Theme.DARK;
    }

    @Override
    public String render(String label) {
      return "<# " + label + " #>";
    }
  }

  private static final class DarkCheckbox implements Checkbox {
    @Override
    public Theme theme() {
      return Theme.DARK;
    }

    @Override
    public String render(String label, boolean checked) {
      return (checked ? "<#> " : "< > ") + label;
    }
  }
}
