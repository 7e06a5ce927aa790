package practice.gof.creational.builder;

import java.io.PrintStream;

public final class BuilderDemo {
  public static void run(PrintStream out) {
    Computer custom =
        Computer.builder().cpu("8-core").ramGigabytes(16).addStorage("512GB SSD").build();
    out.println("custom -> " + custom.describe());

    ComputerDirector director = new ComputerDirector();
    out.println("office -> " + director.office().describe());
    out.println("gaming -> " + director.gaming().describe());

    try {
      Computer.builder().ramGigabytes(4).build();
    } catch (IllegalStateException e) {
      out.println("incomplete build rejected: " + e.getMessage());
    }
  }

  private BuilderDemo() {}
}
