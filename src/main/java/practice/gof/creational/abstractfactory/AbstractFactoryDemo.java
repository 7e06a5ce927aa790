package practice.gof.creational.abstractfactory;

import java.io.PrintStream;

public final class AbstractFactoryDemo {
  public static void run(PrintStream out) {
    for (Theme theme : Theme.values()) {
      SettingsDialog dialog = new SettingsDialog(WidgetFactory.of(theme));
      out.println(theme + " theme:");
      for (String line : dialog.render(theme == Theme.DARK)) {
        out.println("  " + line);
      }
    }
  }

  private AbstractFactoryDemo() {}
}
