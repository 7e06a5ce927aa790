package practice.gof.structural.facade;

final class Lights {
  private final StepLog log;

  Lights(StepLog log) {
    this.log = log;
  }

  void dim(int percent) {
    log.record("Lights dimmed to " + percent + "%");
  }

  void on() {
    log.record("Lights on");
  }
}
