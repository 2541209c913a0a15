package tenantdb.config;

import tenantdb.ConfigurationException;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

  @Test
  void dottedKeysExpandIntoSections() {
    Settings settings = Settings.of(Map.of("database.pool.min", 4, "database.jdbcUrl", "jdbc:h2:mem:x"));

    assertEquals(4, settings.getInt("database.pool.min", 0));
    assertEquals("jdbc:h2:mem:x", settings.section("database").getString("jdbcUrl", null));
    assertTrue(settings.has("database.pool"));
  }

  @Test
  void mergeIsDeepAndLaterLayerWins() {
    Settings base = Settings.of(Map.of("transactions.timeout", 30_000L, "transactions.maxRetries", 3));
    Settings override = Settings.of(Map.of("transactions.maxRetries", 5));

    Settings merged = base.merge(override);

    assertEquals(30_000L, merged.getLong("transactions.timeout", 0));
    assertEquals(5, merged.getInt("transactions.maxRetries", 0));
    assertEquals(3, base.getInt("transactions.maxRetries", 0));
  }

  @Test
  void listsReplaceRatherThanConcatenate() {
    Settings base = Settings.of(Map.of("models.names", List.of("a", "b")));
    Settings override = Settings.of(Map.of("models.names", List.of("c")));

    assertEquals(List.of("c"), base.merge(override).get("models.names"));
  }

  @Test
  void nullValuesAreDropped() {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("cwd", null);
    source.put("shared", true);

    Settings settings = Settings.of(source);

    assertFalse(settings.has("cwd"));
    assertTrue(settings.getBoolean("shared", false));
  }

  @Test
  void layeredMergesLeftToRight() {
    Settings result = Settings.layered(
        Settings.of(Map.of("a", 1)),
        null,
        Settings.of(Map.of("a", 2, "b", 3)));

    assertEquals(2, result.getInt("a", 0));
    assertEquals(3, result.getInt("b", 0));
  }

  @Test
  void stringValuesAreCoerced() {
    Settings settings = Settings.of(Map.of("n", " 42 ", "flag", "TRUE"));

    assertEquals(42L, settings.getLong("n", 0));
    assertTrue(settings.getBoolean("flag", false));
  }

  @Test
  void malformedValuesRaiseConfigurationException() {
    Settings settings = Settings.of(Map.of("n", "many", "flag", "maybe"));

    assertThrows(ConfigurationException.class, () -> settings.getLong("n", 0));
    assertThrows(ConfigurationException.class, () -> settings.getBoolean("flag", false));
  }

  @Test
  void missingPathsReturnDefaults() {
    Settings settings = Settings.empty();

    assertEquals("x", settings.getString("a.b.c", "x"));
    assertTrue(settings.section("a").isEmpty());
    assertNull(settings.get("a"));
  }

  @Test
  void withSetsOnePath() {
    Settings settings = Defaults.settings().with("database.pool.max", 20);

    assertEquals(20, settings.getInt("database.pool.max", 0));
    assertEquals(2, settings.getInt("database.pool.min", 0));
  }
}
