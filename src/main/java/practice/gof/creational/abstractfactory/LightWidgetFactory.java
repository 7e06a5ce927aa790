package practice.gof.creational.abstractfactory;

final class LightWidgetFactory implements WidgetFactory {
  @Override
  public Button createButton() {
    return new LightButton();
  }

  @Override
  public Checkbox createCheckbox() {
    return new LightCheckbox();
  }

  private static final class LightButton implements Button {
    @Override
    public Theme theme() {
      return Theme.LIGHT;
    }

    @Override
    public String render(String label) {
      return "[ " + label + " ]";
    }
  }

  private static final class LightCheckbox implements Checkbox {
    @Override
    public Theme theme() {
      return Theme.LIGHT;
    }

    @Override
    public String render(String label, boolean checked) {
      return (checked ? "[x] " : "[ ] ") + label;
    }
  }
}
