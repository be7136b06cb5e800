package feedwatch.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

    @Test
    void createsSequentiallyNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("feedwatch-worker-");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("feedwatch-worker-1", first.getName());
        assertEquals("feedwatch-worker-2", second.getName());
        assertTrue(first.isDaemon());
        assertTrue(second.isDaemon());
    }

    @Test
    void installsUncaughtExceptionHandler() {
        Thread thread = new DaemonThreadFactory("feedwatch-scheduler-").newThread(() -> { });

        assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
    }

    @Test
    void survivesFailingTask() throws InterruptedException {
        Thread thread = new DaemonThreadFactory("failing-").newThread(() -> {
            throw new IllegalStateException("boom");
        });
        thread.start();
        thread.join(5000);

        assertFalse(thread.isAlive());
    }

    @Test
    void rejectsInvalidPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
        assertThrows(IllegalArgumentException.class, () -> new DaemonThreadFactory(" "));
    }
}
