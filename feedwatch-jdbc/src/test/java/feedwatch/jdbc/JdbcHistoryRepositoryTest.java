package feedwatch.jdbc;

import feedwatch.HistoryRecord;
import feedwatch.jdbc.store.AbstractJdbcHistoryStore;
import feedwatch.jdbc.store.H2HistoryStore;
import feedwatch.jdbc.store.MySqlHistoryStore;
import feedwatch.jdbc.store.PostgresHistoryStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcHistoryRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private JdbcHistoryRepository repository(String mode, AbstractJdbcHistoryStore store, Instant now)
            throws SQLException {
        JdbcDataSource dataSource = H2Schema.dataSource(mode);
        H2Schema.createHistory(dataSource, store.tableName());
        return new JdbcHistoryRepository(new DataSourceConnectionProvider(dataSource), store,
                Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void recordThenLookup() throws SQLException {
        JdbcHistoryRepository history = repository(null, new H2HistoryStore(), NOW);

        assertFalse(history.hasBeenNotified(1L, "A1"));
        history.recordNotified(1L, "A1", "https://example.com/p/A1/");

        assertTrue(history.hasBeenNotified(1L, "A1"));
        assertFalse(history.hasBeenNotified(2L, "A1"));
        HistoryRecord record = history.find(1L, "A1").orElseThrow();
        assertEquals("https://example.com/p/A1/", record.url());
        assertEquals(NOW, record.notifiedAt());
    }

    @Test
    void h2RecordIsIdempotent() throws SQLException {
        assertIdempotent(repository(null, new H2HistoryStore(), NOW));
    }

    @Test
    void mySqlRecordIsIdempotent() throws SQLException {
        assertIdempotent(repository("MySQL", new MySqlHistoryStore(), NOW));
    }

    @Test
    void postgresRecordIsIdempotent() throws SQLException {
        assertIdempotent(repository("PostgreSQL", new PostgresHistoryStore(), NOW));
    }

    private void assertIdempotent(JdbcHistoryRepository history) {
        history.recordNotified(7L, "B2", "https://example.com/p/B2/");
        assertDoesNotThrow(() -> history.recordNotified(7L, "B2", "https://example.com/other"));

        HistoryRecord record = history.find(7L, "B2").orElseThrow();
        assertEquals("https://example.com/p/B2/", record.url());
    }

    @Test
    void pruneDeletesOnlyRecordsOlderThanRetention() throws SQLException {
        JdbcDataSource dataSource = H2Schema.dataSource(null);
        H2Schema.createHistory(dataSource, "feed_history");
        ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
        H2HistoryStore store = new H2HistoryStore();

        new JdbcHistoryRepository(provider, store, Clock.fixed(NOW.minus(Duration.ofDays(40)), ZoneOffset.UTC))
                .recordNotified(1L, "OLD", "u1");
        new JdbcHistoryRepository(provider, store, Clock.fixed(NOW.minus(Duration.ofDays(29)), ZoneOffset.UTC))
                .recordNotified(1L, "RECENT", "u2");
        JdbcHistoryRepository history = new JdbcHistoryRepository(provider, store, Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(1, history.pruneOlderThan(Duration.ofDays(30)));
        assertFalse(history.hasBeenNotified(1L, "OLD"));
        assertTrue(history.hasBeenNotified(1L, "RECENT"));
        assertEquals(0, history.pruneOlderThan(Duration.ofDays(30)));
    }

    @Test
    void pruneReportsDeletionsOnlyAtFineLevel() throws SQLException {
        JdbcDataSource dataSource = H2Schema.dataSource(null);
        H2Schema.createHistory(dataSource, "feed_history");
        ConnectionProvider provider = new DataSourceConnectionProvider(dataSource);
        H2HistoryStore store = new H2HistoryStore();
        new JdbcHistoryRepository(provider, store, Clock.fixed(NOW.minus(Duration.ofDays(40)), ZoneOffset.UTC))
                .recordNotified(1L, "OLD", "u1");
        JdbcHistoryRepository history = new JdbcHistoryRepository(provider, store, Clock.fixed(NOW, ZoneOffset.UTC));

        Logger logger = Logger.getLogger(JdbcHistoryRepository.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Level previous = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
        try {
            assertEquals(1, history.pruneOlderThan(Duration.ofDays(30)));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previous);
        }

        assertEquals(1, records.size());
        assertEquals(Level.FINE, records.get(0).getLevel());
    }

    @Test
    void pruneRejectsNegativeRetention() throws SQLException {
        JdbcHistoryRepository history = repository(null, new H2HistoryStore(), NOW);

        assertThrows(IllegalArgumentException.class, () -> history.pruneOlderThan(Duration.ofDays(-1)));
    }

    @Test
    void customTableName() throws SQLException {
        JdbcHistoryRepository history = repository(null, new H2HistoryStore().withTableName("ig_history"), NOW);

        history.recordNotified(3L, "C3", null);

        assertTrue(history.hasBeenNotified(3L, "C3"));
        assertNull(history.find(3L, "C3").orElseThrow().url());
    }

    @Test
    void missingTableSurfacesAsFeedStoreException() throws SQLException {
        JdbcDataSource dataSource = H2Schema.dataSource(null);
        JdbcHistoryRepository history = new JdbcHistoryRepository(
                new DataSourceConnectionProvider(dataSource), new H2HistoryStore());

        assertThrows(FeedStoreException.class, () -> history.hasBeenNotified(1L, "X"));
        assertThrows(FeedStoreException.class, () -> history.recordNotified(1L, "X", "u"));
        assertThrows(FeedStoreException.class, () -> history.pruneOlderThan(Duration.ofDays(1)));
    }
}
