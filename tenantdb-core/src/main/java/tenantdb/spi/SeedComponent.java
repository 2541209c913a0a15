package tenantdb.spi;

/**
 * Seed data collaborator.
 */
public interface SeedComponent extends ScriptComponent {
}
