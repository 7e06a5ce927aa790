package practice.gof.structural.decorator;

import java.io.PrintStream;
import java.util.List;

public final class DecoratorDemo {
  public static void run(PrintStream out) {
    List<Coffee> orders =
        List.of(
            new Espresso(),
            new Milk(new Espresso()),
            new WhippedCream(new Sugar(new Milk(new Espresso()))),
            new Milk(new Milk(new Espresso())));
    for (Coffee coffee : orders) {
      out.println(coffee.description() + " -> " + coffee.cost() + " yen");
    }
  }

  private DecoratorDemo() {}
}
