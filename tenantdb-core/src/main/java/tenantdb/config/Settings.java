package tenantdb.config;

import tenantdb.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, layered configuration tree.
 *
 * <p>Keys may be given in dotted form ({@code database.pool.min}); they are expanded into nested
 * sections on construction. Layers combine with {@link #merge(Settings)}: nested sections merge
 * key by key, the later layer wins on conflicts, and lists replace rather than concatenate.
 *
 * <pre>{@code
 * Settings merged = Defaults.settings()
 *     .merge(Settings.of(Map.of("transactions.maxRetries", 5)))
 *     .merge(tenantOverrides);
 * long timeout = merged.getLong("transactions.timeout", 30_000L);
 * }</pre>
 */
public final class Settings {
  private static final Settings EMPTY = new Settings(Map.of());

  private final Map<String, Object> values;

  private Settings(Map<String, Object> values) {
    this.values = values;
  }

  public static Settings empty() {
    return EMPTY;
  }

  /**
   * Builds settings from a (possibly dotted, possibly nested) map. {@code null} values are dropped.
   */
  public static Settings of(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return EMPTY;
    }
    return new Settings(freeze(expand(source)));
  }

  /**
   * Merges layers left to right.
   */
  public static Settings layered(Settings... layers) {
    Settings result = EMPTY;
    for (Settings layer : layers) {
      if (layer != null) {
        result = result.merge(layer);
      }
    }
    return result;
  }

  /**
   * Returns a new tree with {@code overrides} laid on top of this one.
   */
  public Settings merge(Settings overrides) {
    if (overrides == null || overrides.values.isEmpty()) {
      return this;
    }
    if (values.isEmpty()) {
      return overrides;
    }
    return new Settings(freeze(deepMerge(values, overrides.values)));
  }

  /**
   * Returns a copy with one dotted path set.
   */
  public Settings with(String path, Object value) {
    return merge(Settings.of(Collections.singletonMap(path, value)));
  }

  /**
   * Returns the raw value at a dotted path, or {@code null}.
   */
  public Object get(String path) {
    Objects.requireNonNull(path, "path");
    Object current = values;
    for (String part : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(part);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  public boolean has(String path) {
    return get(path) != null;
  }

  public String getString(String path, String defaultValue) {
    Object value = get(path);
    if (value == null || value instanceof Map) {
      return defaultValue;
    }
    return value.toString();
  }

  public long getLong(String path, long defaultValue) {
    Object value = get(path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Setting '" + path + "' must be a number, got: " + value,
          "configuration", null, e);
    }
  }

  public int getInt(String path, int defaultValue) {
    long value = getLong(path, defaultValue);
    if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
      throw new ConfigurationException("Setting '" + path + "' is out of range: " + value, "configuration", null);
    }
    return (int) value;
  }

  public boolean getBoolean(String path, boolean defaultValue) {
    Object value = get(path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new ConfigurationException("Setting '" + path + "' must be true or false, got: " + value,
        "configuration", null);
  }

  /**
   * Returns the nested section at {@code path}, or empty settings.
   */
  public Settings section(String path) {
    Object value = get(path);
    if (value instanceof Map<?, ?> map) {
      @SuppressWarnings("unchecked")
      Map<String, Object> nested = (Map<String, Object>) map;
      return new Settings(nested);
    }
    return EMPTY;
  }

  /**
   * Returns the tree as an unmodifiable nested map.
   */
  public Map<String, Object> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Settings other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Settings" + values;
  }

  private static Map<String, Object> expand(Map<String, ?> source) {
    Map<String, Object> root = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      Object value = normalize(entry.getValue());
      if (value == null) {
        continue;
      }
      String[] parts = entry.getKey().split("\\.");
      Map<String, Object> target = root;
      for (int i = 0; i < parts.length - 1; i++) {
        target = childSection(target, parts[i]);
      }
      String leaf = parts[parts.length - 1];
      Object existing = target.get(leaf);
      if (existing instanceof Map<?, ?> && value instanceof Map<?, ?>) {
        target.put(leaf, deepMerge(asStringMap(existing), asStringMap(value)));
      } else {
        target.put(leaf, value);
      }
    }
    return root;
  }

  private static Map<String, Object> childSection(Map<String, Object> parent, String key) {
    Object child = parent.get(key);
    if (child instanceof Map<?, ?>) {
      return asStringMap(child);
    }
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(key, created);
    return created;
  }

  private static Object normalize(Object value) {
    if (value instanceof Settings settings) {
      return expand(settings.values);
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> nested = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        nested.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      return expand(nested);
    }
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    return value;
  }

  private static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overrides) {
    Map<String, Object> result = new LinkedHashMap<>(base);
    for (Map.Entry<String, Object> entry : overrides.entrySet()) {
      Object current = result.get(entry.getKey());
      Object incoming = entry.getValue();
      if (current instanceof Map<?, ?> && incoming instanceof Map<?, ?>) {
        result.put(entry.getKey(), deepMerge(asStringMap(current), asStringMap(incoming)));
      } else {
        result.put(entry.getKey(), incoming);
      }
    }
    return result;
  }

  private static Map<String, Object> freeze(Map<String, Object> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        value = freeze(asStringMap(value));
      } else if (value instanceof List<?> list) {
        value = Collections.unmodifiableList(new ArrayList<>(list));
      }
      copy.put(entry.getKey(), value);
    }
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asStringMap(Object value) {
    return (Map<String, Object>) value;
  }
}
