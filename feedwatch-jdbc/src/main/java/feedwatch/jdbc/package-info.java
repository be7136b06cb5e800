/**
 * JDBC implementations of {@link feedwatch.spi.SourceRegistry} and {@link feedwatch.spi.HistoryStore}.
 *
 * <p>Expected schema with the default {@code feed_} prefix (adjust the identity column to the
 * database):
 * <pre>{@code
 * CREATE TABLE feed_source (
 *   id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   handle VARCHAR(255) NOT NULL UNIQUE,
 *   display_name VARCHAR(255),
 *   last_item_id VARCHAR(255),
 *   last_checked_at TIMESTAMP,
 *   active BOOLEAN NOT NULL DEFAULT TRUE
 * );
 *
 * CREATE TABLE feed_destination (
 *   id BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   source_id BIGINT NOT NULL,
 *   destination_id VARCHAR(255) NOT NULL,
 *   message_template VARCHAR(2000),
 *   mention_id VARCHAR(255),
 *   UNIQUE (source_id, destination_id)
 * );
 *
 * CREATE TABLE feed_history (
 *   source_id BIGINT NOT NULL,
 *   item_id VARCHAR(255) NOT NULL,
 *   url VARCHAR(2048),
 *   notified_at TIMESTAMP NOT NULL,
 *   PRIMARY KEY (source_id, item_id)
 * );
 * CREATE INDEX idx_feed_history_notified_at ON feed_history (notified_at);
 * }</pre>
 *
 * @see feedwatch.jdbc.JdbcSourceRegistry
 * @see feedwatch.jdbc.JdbcHistoryRepository
 * @see feedwatch.jdbc.store.JdbcHistoryStores
 */
package feedwatch.jdbc;
