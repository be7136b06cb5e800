package feedwatch.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void defaultNamesUseFeedPrefix() {
        assertEquals("feed_source", TableNames.DEFAULT.source());
        assertEquals("feed_destination", TableNames.DEFAULT.destination());
        assertEquals("feed_history", TableNames.DEFAULT.history());
    }

    @Test
    void customPrefixIsApplied() {
        TableNames names = TableNames.withPrefix("ig_");

        assertEquals("ig_source", names.source());
        assertEquals("ig_history", names.history());
    }

    @Test
    void emptyPrefixYieldsBareNames() {
        assertEquals("destination", TableNames.withPrefix("").destination());
    }

    @Test
    void validTableNameReturnsName() {
        assertEquals("feed_history", TableNames.validate("feed_history"));
        assertEquals("History2", TableNames.validate("History2"));
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void tableNameStartingWithDigitThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1history"));
    }

    @Test
    void injectionAttemptInPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("x; DROP TABLE y; --"));
    }
}
