package practice.gof.structural.facade;

final class StreamingPlayer {
  private final StepLog log;
  private String playing;

  StreamingPlayer(StepLog log) {
    this.log = log;
  }

  void on() {
    log.record("Player on");
  }

  void play(String title) {
    playing = title;
    log.record("Player playing \"" + title + "\"");
  }

  void stop() {
    if (playing != null) {
      log.record("Player stopped \"" + playing + "\"");
      playing = null;
    }
  }

  boolean isPlaying() {
    return playing != null;
  }

  void off() {
    log.record("Player off");
  }
}
