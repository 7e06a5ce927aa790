package practice.gof.structural.facade;

import java.util.ArrayList;
import java.util.List;

// shared by the subsystem parts so the facade can report what happened
final class StepLog {
  private final List<String> steps = new ArrayList<>();

  void record(String step) {
    steps.add(step);
  }

  List<String> drain() {
    List<String> drained = List.copyOf(steps);
    steps.clear();
    return drained;
  }
}
