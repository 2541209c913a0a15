package tenantdb.config;

import tenantdb.spi.ComponentSlot;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view over a tenant's merged settings.
 *
 * <p>Recognized keys: {@code database.*}, {@code shared}, {@code useConnection}, {@code cwd},
 * and per-slot sections {@code security}, {@code migrations}, {@code seeds}, {@code models},
 * {@code transactions}, each with an {@code enabled} flag.
 */
public final class TenantConfig {

  /**
   * {@code useConnection} value requesting any compatible shared connection.
   */
  public static final String ANY_COMPATIBLE = "*";

  private final Settings settings;

  private TenantConfig(Settings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public static TenantConfig of(Settings settings) {
    return new TenantConfig(settings);
  }

  public static TenantConfig of(Map<String, ?> settings) {
    return new TenantConfig(Settings.of(settings));
  }

  public Settings settings() {
    return settings;
  }

  /**
   * Returns this configuration with {@code base} laid underneath it.
   */
  public TenantConfig withBase(Settings base) {
    return new TenantConfig(base.merge(settings));
  }

  public DatabaseConfig database() {
    return DatabaseConfig.from(settings);
  }

  public boolean hasDatabase() {
    return database().hasConnectionDetails();
  }

  public boolean isShared() {
    return database().shared();
  }

  /**
   * Connection this tenant wants to reuse: a tenant name, or {@link #ANY_COMPATIBLE} when
   * {@code useConnection} is {@code true}, {@code "global"} or {@code "*"}.
   */
  public Optional<String> useConnection() {
    Object value = settings.get("useConnection");
    if (value == null || Boolean.FALSE.equals(value)) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    if (text.isEmpty() || "false".equalsIgnoreCase(text)) {
      return Optional.empty();
    }
    if ("true".equalsIgnoreCase(text) || "global".equalsIgnoreCase(text) || ANY_COMPATIBLE.equals(text)) {
      return Optional.of(ANY_COMPATIBLE);
    }
    return Optional.of(text);
  }

  public Path workingDirectory() {
    return Paths.get(settings.getString("cwd", System.getProperty("user.dir")));
  }

  public boolean isEnabled(ComponentSlot slot) {
    return settings.getBoolean(slot.configKey() + ".enabled", false);
  }

  public Settings slotSettings(ComponentSlot slot) {
    return settings.section(slot.configKey());
  }

  /**
   * Model definitions under {@code models.definitions}, keyed by model name.
   */
  public Map<String, Object> modelDefinitions() {
    return settings.section("models.definitions").asMap();
  }

  @Override
  public String toString() {
    return "TenantConfig[database=" + database() + ", useConnection=" + useConnection().orElse(null) + "]";
  }
}
