package practice.gof.creational.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ComputerTest {

  @Test
  @DisplayName("builder assembles the product step by step")
  void buildsStepByStep() {
    Computer computer =
        Computer.builder()
            .cpu("8-core")
            .ramGigabytes(16)
            .addStorage("512GB SSD")
            .addStorage("1TB HDD")
            .wifi(true)
            .build();

    assertThat(computer.cpu()).isEqualTo("8-core");
    assertThat(computer.ramGigabytes()).isEqualTo(16);
    assertThat(computer.storage()).containsExactly("512GB SSD", "1TB HDD");
    assertThat(computer.graphicsCard()).isNull();
    assertThat(computer.wifi()).isTrue();
    assertThat(computer.describe()).contains("graphicsCard=onboard");
  }

  @Test
  @DisplayName("later builder changes do not leak into a built product")
  void productIsImmutable() {
    Computer.Builder builder = Computer.builder().cpu("4-core").ramGigabytes(8).addStorage("SSD");
    Computer first = builder.build();
    builder.addStorage("HDD");

    assertThat(first.storage()).containsExactly("SSD");
    assertThatThrownBy(() -> first.storage().add("USB"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Nested
  class Validation {

    @Test
    void cpuIsRequired() {
      assertThatThrownBy(() -> Computer.builder().ramGigabytes(8).build())
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("cpu");
    }

    @Test
    void ramIsRequired() {
      assertThatThrownBy(() -> Computer.builder().cpu("4-core").build())
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("ram");
    }

    @Test
    void ramMustBePositive() {
      assertThatThrownBy(() -> Computer.builder().ramGigabytes(0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void directorBuildsPresets() {
    ComputerDirector director = new ComputerDirector();

    assertThat(director.office().graphicsCard()).isNull();
    assertThat(director.gaming().graphicsCard()).isEqualTo("RTX");
    assertThat(director.gaming().storage()).hasSize(2);
  }
}
