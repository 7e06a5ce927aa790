package practice.gof.structural.bridge;

import java.io.PrintStream;
import java.util.List;

public final class BridgeDemo {
  public static void run(PrintStream out) {
    List<Shape> shapes =
        List.of(
            new Circle(new Red()),
            new Circle(new Blue()),
            new Square(new Red()),
            new Square(new Blue()));
    for (Shape shape : shapes) {
      out.println(shape.describe());
    }
  }

  private BridgeDemo() {}
}
