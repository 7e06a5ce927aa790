package practice.gof.creational.abstractfactory;

/** Creates a family of widgets that belong to the same theme. */
interface WidgetFactory {
  Button createButton();

  Checkbox createCheckbox();

  static WidgetFactory of(Theme theme) {
    switch (theme) {
      case LIGHT:
        return new LightWidgetFactory();
      case DARK:
        return new DarkWidgetFactory();
      default:
        throw new IllegalArgumentException("unsupported theme: " + theme);
    }
  }
}
