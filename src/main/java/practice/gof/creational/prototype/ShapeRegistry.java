package practice.gof.creational.prototype;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class ShapeRegistry {
  private final Map<String, Shape> prototypes = new LinkedHashMap<>();

  void register(String key, Shape prototype) {
    prototypes.put(key, prototype.copy());
  }

  Shape create(String key) {
    Shape prototype = prototypes.get(key);
    if (prototype == null) {
      throw new IllegalArgumentException("no prototype registered for: " + key);
    }
    return prototype.copy();
  }

  Set<String> keys() {
    return Set.copyOf(prototypes.keySet());
  }
}
