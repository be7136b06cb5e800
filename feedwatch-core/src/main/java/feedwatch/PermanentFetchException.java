package feedwatch;

/**
 * Fetch failure the upstream will keep returning, such as HTTP 4xx or a missing profile.
 *
 * <p>Not retried within a check. The source is tried again on the next cycle.
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(String message) {
        super(message);
    }

    public PermanentFetchException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public PermanentFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
