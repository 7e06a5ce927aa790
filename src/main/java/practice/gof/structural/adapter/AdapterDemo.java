package practice.gof.structural.adapter;

import java.io.PrintStream;
import java.util.Locale;

public final class AdapterDemo {
  public static void run(PrintStream out) {
    RoundHole hole = new RoundHole(5);
    out.println("round peg r=5 fits: " + hole.fits(new WoodenRoundPeg(5)));

    for (double width : new double[] {5, 10}) {
      SquarePegAdapter adapter = new SquarePegAdapter(new SquarePeg(width));
      out.println(
          String.format(
              Locale.ROOT,
              "square peg w=%.0f (as r=%.2f) fits: %s",
              width,
              adapter.radius(),
              hole.fits(adapter)));
    }
  }

  private AdapterDemo() {}
}
