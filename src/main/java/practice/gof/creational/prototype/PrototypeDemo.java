package practice.gof.creational.prototype;

import java.io.PrintStream;

public final class PrototypeDemo {
  public static void run(PrintStream out) {
    Circle original = new Circle(0, 0, "red", 5);
    original.tag("template");
    Shape clone = original.copy();
    clone.moveTo(10, 20);
    clone.tag("moved");
    out.println("original -> " + original.describe());
    out.println("clone    -> " + clone.describe());
    out.println("distinct objects: " + (original != clone));

    ShapeRegistry registry = new ShapeRegistry();
    registry.register("big-blue-rectangle", new Rectangle(0, 0, "blue", 40, 30));
    Shape fromRegistry = registry.create("big-blue-rectangle");
    fromRegistry.paint("green");
    out.println("registry copy -> " + fromRegistry.describe());
    out.println("registry copy again -> " + registry.create("big-blue-rectangle").describe());
  }

  private PrototypeDemo() {}
}
