package feedwatch.spi;

import feedwatch.Destination;

import java.util.List;

/**
 * Reads the most recent messages of a destination, used as a duplicate safety net for items
 * that were posted out of band.
 */
@FunctionalInterface
public interface RecentMessageScanner {

    /**
     * @param destination destination to scan
     * @param limit       maximum number of messages, newest first
     * @return message texts
     * @throws Exception if the destination cannot be read
     */
    List<String> recentMessages(Destination destination, int limit) throws Exception;
}
