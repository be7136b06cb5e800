package feedwatch.retry;

import java.time.Duration;

/**
 * Blocking pause, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread via {@link Thread#sleep(long)}.
     */
    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
