package practice.gof.structural.facade;

final class Projector {
  private final StepLog log;

  Projector(StepLog log) {
    this.log = log;
  }

  void on() {
    log.record("Projector on");
  }

  void wideScreenMode() {
    log.record("Projector wide-screen mode");
  }

  void off() {
    log.record("Projector off");
  }
}
