/**
 * Dialect-specific history stores.
 *
 * <p>{@link feedwatch.jdbc.store.AbstractJdbcHistoryStore} provides shared SQL and row mapping;
 * subclasses supply the idempotent insert: H2 (plain insert, unique violation ignored),
 * MySQL ({@code INSERT IGNORE}) and PostgreSQL ({@code ON CONFLICT DO NOTHING}).
 *
 * @see feedwatch.jdbc.store.JdbcHistoryStores
 */
package feedwatch.jdbc.store;
