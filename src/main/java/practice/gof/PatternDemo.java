package practice.gof;

import java.io.PrintStream;

@FunctionalInterface
public interface PatternDemo {
  void run(PrintStream out);
}
