package practice.gof.structural.facade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HomeTheaterFacadeTest {

  @Test
  void watchMovieDrivesSubsystemsInOrder() {
    HomeTheaterFacade facade = new HomeTheaterFacade();

    assertThat(facade.watchMovie("Ikiru"))
        .containsExactly(
            "Lights dimmed to 10%",
            "Projector on",
            "Projector wide-screen mode",
            "Amplifier on",
            "Amplifier volume 5",
            "Player on",
            "Player playing \"Ikiru\"");
    assertThat(facade.isPlaying()).isTrue();
  }

  @Test
  void endMovieShutsEverythingDown() {
    HomeTheaterFacade facade = new HomeTheaterFacade();
    facade.watchMovie("Ikiru");

    assertThat(facade.endMovie())
        .containsExactly(
            "Player stopped \"Ikiru\"",
            "Player off",
            "Amplifier off",
            "Projector off",
            "Lights on");
    assertThat(facade.isPlaying()).isFalse();
  }

  @Test
  void amplifierRejectsOutOfRangeVolume() {
    Amplifier amplifier = new Amplifier(new StepLog());

    assertThatThrownBy(() -> amplifier.setVolume(11)).isInstanceOf(IllegalArgumentException.class);
  }
}
