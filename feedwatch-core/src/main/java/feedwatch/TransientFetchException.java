package feedwatch;

/**
 * Fetch failure that may succeed on retry: connection errors, timeouts, HTTP 5xx and 429.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientFetchException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
