package practice.gof.creational.singleton;

import java.io.PrintStream;

public final class SingletonDemo {
  public static void run(PrintStream out) {
    SerialNumberGenerator first = SerialNumberGenerator.getInstance();
    SerialNumberGenerator second = SerialNumberGenerator.getInstance();
    out.println("same instance: " + (first == second));
    out.println("first.next()  -> " + first.next());
    out.println("second.next() -> " + second.next());

    AppSettings settings = AppSettings.INSTANCE;
    String theme = settings.get("theme");
    settings.set("theme", "dark");
    try {
      out.println("enum singleton theme=" + AppSettings.INSTANCE.get("theme"));
    } finally {
      settings.set("theme", theme);
    }
  }

  private SingletonDemo() {}
}
