package practice.gof.structural.facade;

import java.util.List;

/** One call per use case instead of driving every device by hand. */
final class HomeTheaterFacade {
  private final StepLog log;
  private final Amplifier amplifier;
  private final Projector projector;
  private final StreamingPlayer player;
  private final Lights lights;

  HomeTheaterFacade() {
    this(new StepLog());
  }

  private HomeTheaterFacade(StepLog log) {
    this.log = log;
    this.amplifier = new Amplifier(log);
    this.projector = new Projector(log);
    this.player = new StreamingPlayer(log);
    this.lights = new Lights(log);
  }

  List<String> watchMovie(String title) {
    lights.dim(10);
    projector.on();
    projector.wideScreenMode();
    amplifier.on();
    amplifier.setVolume(5);
    player.on();
    player.play(title);
    return log.drain();
  }

  List<String> endMovie() {
    player.stop();
    player.off();
    amplifier.off();
    projector.off();
    lights.on();
    return log.drain();
  }

  boolean isPlaying() {
    return player.isPlaying();
  }
}
