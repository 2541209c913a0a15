/**
 * Observer interface for lifecycle notifications. Event names are a stable contract.
 */
package tenantdb.event;
