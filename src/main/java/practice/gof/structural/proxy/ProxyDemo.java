package practice.gof.structural.proxy;

import java.io.PrintStream;
import java.util.List;

public final class ProxyDemo {
  public static void run(PrintStream out) {
    List<LazyImageProxy> gallery =
        List.of(new LazyImageProxy("mountain.png"), new LazyImageProxy("sea.png"));
    out.println("gallery created, loaded=" + loadedFlags(gallery));

    LazyImageProxy first = gallery.get(0);
    out.println(first.display());
    out.println(first.display());
    out.println("after viewing one, loaded=" + loadedFlags(gallery));
  }

  private static List<Boolean> loadedFlags(List<LazyImageProxy> gallery) {
    return gallery.stream().map(LazyImageProxy::isLoaded).toList();
  }

  private ProxyDemo() {}
}
