package practice.gof.structural.facade;

final class Amplifier {
  private final StepLog log;

  Amplifier(StepLog log) {
    this.log = log;
  }

  void on() {
    log.record("Amplifier on");
  }

  void setVolume(int volume) {
    if (volume < 0 || volume > 10) {
      throw new IllegalArgumentException("volume must be 0..10: " + volume);
    }
    log.record("Amplifier volume " + volume);
  }

  void off() {
    log.record("Amplifier off");
  }
}
