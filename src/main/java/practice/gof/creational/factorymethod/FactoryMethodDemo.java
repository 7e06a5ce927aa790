package practice.gof.creational.factorymethod;

import java.io.PrintStream;
import java.util.List;

public final class FactoryMethodDemo {
  public static void run(PrintStream out) {
    for (String route : List.of("road", "sea")) {
      Logistics logistics = Logistics.forRoute(route);
      out.println(route + " -> " + logistics.planDelivery("10 boxes"));
    }
  }

  private FactoryMethodDemo() {}
}
