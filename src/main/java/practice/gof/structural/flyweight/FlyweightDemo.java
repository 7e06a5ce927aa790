package practice.gof.structural.flyweight;

import java.io.PrintStream;

public final class FlyweightDemo {
  public static void run(PrintStream out) {
    TreeTypeFactory factory = new TreeTypeFactory();
    Forest forest = new Forest(factory);
    for (int i = 0; i < 6; i++) {
      if (i % 2 == 0) {
        forest.plant(i * 10, i * 5, "Oak", "green", "rough");
      } else {
        forest.plant(i * 10, i * 5, "Cherry", "pink", "smooth");
      }
    }
    forest.draw().forEach(out::println);
    out.println("trees=" + forest.trees().size() + ", shared tree types=" + factory.cachedTypes());
  }

  private FlyweightDemo() {}
}
