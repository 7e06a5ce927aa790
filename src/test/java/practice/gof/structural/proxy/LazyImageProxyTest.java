package practice.gof.structural.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LazyImageProxyTest {

  @Test
  @DisplayName("nothing is loaded until the first display")
  void loadsLazily() {
    AtomicInteger loads = new AtomicInteger();
    LazyImageProxy proxy =
        new LazyImageProxy(
            "photo.png",
            fileName -> {
              loads.incrementAndGet();
              return new HighResolutionImage(fileName);
            });

    assertThat(proxy.isLoaded()).isFalse();
    assertThat(proxy.fileName()).isEqualTo("photo.png");
    assertThat(loads).hasValue(0);

    assertThat(proxy.display()).isEqualTo("Displaying photo.png (pixels of photo.png)");
    assertThat(proxy.isLoaded()).isTrue();
    assertThat(loads).hasValue(1);
  }

  @Test
  @DisplayName("the loaded image is reused on later displays")
  void loadsOnce() {
    AtomicInteger loads = new AtomicInteger();
    LazyImageProxy proxy =
        new LazyImageProxy(
            "photo.png",
            fileName -> {
              loads.incrementAndGet();
              return new HighResolutionImage(fileName);
            });

    proxy.display();
    proxy.display();
    proxy.display();

    assertThat(loads).hasValue(1);
  }

  @Test
  void defaultLoaderUsesHighResolutionImage() {
    assertThat(new LazyImageProxy("a.png").display())
        .isEqualTo(new HighResolutionImage("a.png").display());
  }
}
