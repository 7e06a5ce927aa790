package practice.gof;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Pattern catalogue")
class PatternTest {

  @Test
  @DisplayName("covers five creational and seven structural patterns")
  void catalogueCoversTwelvePatterns() {
    assertThat(Pattern.values()).hasSize(12);
    assertThat(Pattern.byCategory(Category.CREATIONAL))
        .containsExactly(
            Pattern.SINGLETON,
            Pattern.FACTORY_METHOD,
            Pattern.ABSTRACT_FACTORY,
            Pattern.BUILDER,
            Pattern.PROTOTYPE);
    assertThat(Pattern.byCategory(Category.STRUCTURAL))
        .containsExactly(
            Pattern.ADAPTER,
            Pattern.BRIDGE,
            Pattern.COMPOSITE,
            Pattern.DECORATOR,
            Pattern.FACADE,
            Pattern.FLYWEIGHT,
            Pattern.PROXY);
  }

  @ParameterizedTest
  @EnumSource(Pattern.class)
  @DisplayName("every entry has a name, an overview and a demo that prints something")
  void everyEntryIsComplete(Pattern pattern) {
    assertThat(pattern.displayName()).isNotBlank();
    assertThat(pattern.overview()).isNotBlank();
    assertThat(pattern.demoOutput()).isNotBlank();
  }

  @Nested
  @DisplayName("fromName")
  class FromName {

    @ParameterizedTest
    @ValueSource(
        strings = {"Factory Method", "FACTORY_METHOD", "factory-method", "  factory method  "})
    void acceptsDisplayNameConstantAndSlug(String name) {
      assertThat(Pattern.fromName(name)).isEqualTo(Pattern.FACTORY_METHOD);
    }

    @Test
    void slugIsKebabCase() {
      assertThat(Pattern.ABSTRACT_FACTORY.slug()).isEqualTo("abstract-factory");
      assertThat(Pattern.PROXY.slug()).isEqualTo("proxy");
    }

    @Test
    void rejectsUnknownNameListingKnownOnes() {
      assertThatThrownBy(() -> Pattern.fromName("observer"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("observer")
          .hasMessageContaining("flyweight");
    }

    @Test
    void rejectsBlankName() {
      assertThatThrownBy(() -> Pattern.fromName(" ")).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> Pattern.fromName(null)).isInstanceOf(IllegalArgumentException.class);
    }
  }
}
