package feedwatch;

/**
 * Raised by registry and history store implementations when storage is unavailable or a
 * statement fails.
 *
 * <p>The monitor catches it per source, so a storage failure for one source never aborts a cycle.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
