package tenantdb.registry;

import tenantdb.supervisor.ConnectionSupervisor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reference counts for shared handles, keyed by fingerprint.
 *
 * <p>An entry exists exactly while at least one tenant references the handle. Not thread-safe;
 * {@link TenantRegistry} calls it under its table lock.
 */
final class SharedHandleTable {

  private static final class Entry {
    final ConnectionSupervisor supervisor;
    final Set<String> tenants = new LinkedHashSet<>();

    Entry(ConnectionSupervisor supervisor) {
      this.supervisor = supervisor;
    }
  }

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  Optional<ConnectionSupervisor> find(String fingerprint) {
    Entry entry = entries.get(fingerprint);
    return entry == null ? Optional.empty() : Optional.of(entry.supervisor);
  }

  /**
   * Adds {@code tenantName} as a reference to {@code supervisor}.
   *
   * @throws IllegalStateException if the fingerprint is owned by another supervisor
   */
  void acquire(String fingerprint, ConnectionSupervisor supervisor, String tenantName) {
    Entry entry = entries.computeIfAbsent(fingerprint, ignored -> new Entry(supervisor));
    if (entry.supervisor != supervisor) {
      throw new IllegalStateException("Fingerprint " + fingerprint + " is already owned by "
          + entry.supervisor.name());
    }
    entry.tenants.add(tenantName);
  }

  /**
   * Drops one reference.
   *
   * @return references left; 0 means the caller held the last one and must tear the handle down
   */
  int release(String fingerprint, String tenantName) {
    Entry entry = entries.get(fingerprint);
    if (entry == null) {
      return 0;
    }
    entry.tenants.remove(tenantName);
    if (entry.tenants.isEmpty()) {
      entries.remove(fingerprint);
      return 0;
    }
    return entry.tenants.size();
  }

  int references(String fingerprint) {
    Entry entry = entries.get(fingerprint);
    return entry == null ? 0 : entry.tenants.size();
  }

  Set<ConnectionSupervisor> supervisors() {
    Set<ConnectionSupervisor> result = new LinkedHashSet<>();
    for (Entry entry : entries.values()) {
      result.add(entry.supervisor);
    }
    return result;
  }

  Map<String, Set<String>> snapshot() {
    Map<String, Set<String>> result = new LinkedHashMap<>();
    entries.forEach((fingerprint, entry) -> result.put(fingerprint, Set.copyOf(entry.tenants)));
    return result;
  }

  void clear() {
    entries.clear();
  }
}
