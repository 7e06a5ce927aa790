package practice.gof.creational.singleton;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

enum AppSettings {
  INSTANCE;

  private final Map<String, String> values =
      new ConcurrentHashMap<>(Map.of("locale", "ja-JP", "theme", "light"));

  String get(String key) {
    String value = values.get(key);
    if (value == null) {
      throw new IllegalArgumentException("unknown setting: " + key);
    }
    return value;
  }

  String getOrDefault(String key, String defaultValue) {
    return values.getOrDefault(key, defaultValue);
  }

  void set(String key, String value) {
    values.put(key, value);
  }
}
