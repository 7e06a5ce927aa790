package practice.gof.structural.flyweight;

import java.util.HashMap;
import java.util.Map;

final class TreeTypeFactory {
  private final Map<TreeType, TreeType> cache = new HashMap<>();

  TreeType get(String name, String color, String texture) {
    return cache.computeIfAbsent(new TreeType(name, color, texture), key -> key);
  }

  int cachedTypes() {
    return cache.size();
  }
}
