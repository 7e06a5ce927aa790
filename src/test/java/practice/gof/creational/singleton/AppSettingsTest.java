package practice.gof.creational.singleton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AppSettingsTest {

  @Test
  void hasDefaults() {
    assertThat(AppSettings.INSTANCE.get("locale")).isEqualTo("ja-JP");
  }

  @Test
  void changesAreVisibleThroughTheSingleInstance() {
    AppSettings.valueOf("INSTANCE").set("font", "mono");

    assertThat(AppSettings.INSTANCE.get("font")).isEqualTo("mono");
  }

  @Test
  void unknownKeyFallsBackOrFails() {
    assertThat(AppSettings.INSTANCE.getOrDefault("missing", "fallback")).isEqualTo("fallback");
    assertThatThrownBy(() -> AppSettings.INSTANCE.get("missing"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("missing");
  }
}
