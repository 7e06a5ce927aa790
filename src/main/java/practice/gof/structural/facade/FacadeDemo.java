package practice.gof.structural.facade;

import java.io.PrintStream;

public final class FacadeDemo {
  public static void run(PrintStream out) {
    HomeTheaterFacade homeTheater = new HomeTheaterFacade();
    out.println("watchMovie:");
    homeTheater.watchMovie("Seven Samurai").forEach(step -> out.println("  " + step));
    out.println("endMovie:");
    homeTheater.endMovie().forEach(step -> out.println("  " + step));
  }

  private FacadeDemo() {}
}
