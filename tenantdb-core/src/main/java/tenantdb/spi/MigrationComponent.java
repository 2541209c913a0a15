package tenantdb.spi;

/**
 * Schema migration collaborator.
 */
public interface MigrationComponent extends ScriptComponent {
}
