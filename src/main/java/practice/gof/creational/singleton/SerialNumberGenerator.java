package practice.gof.creational.singleton;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazily created single instance, initialized by the class loader on the first {@link
 * #getInstance()} call.
 */
final class SerialNumberGenerator {
  private final AtomicInteger sequence = new AtomicInteger(1);

  private SerialNumberGenerator() {}

  static SerialNumberGenerator getInstance() {
    return Holder.INSTANCE;
  }

  String next() {
    return String.format(Locale.ROOT, "SN-%04d", sequence.getAndIncrement());
  }

  private static final class Holder {
    private static final SerialNumberGenerator INSTANCE = new SerialNumberGenerator();
  }
}
