package feedwatch;

/**
 * Checked failure raised by a {@link feedwatch.spi.FetchStrategy}.
 *
 * <p>Use {@link TransientFetchException} for failures worth retrying within the same check and
 * {@link PermanentFetchException} for answers the upstream will repeat (4xx, unknown profile).
 */
public class FetchException extends Exception {

    /** Status code used when the failure did not come from an HTTP response. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public FetchException(String message) {
        this(message, NO_STATUS, null);
    }

    public FetchException(String message, Throwable cause) {
        this(message, NO_STATUS, cause);
    }

    public FetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the upstream HTTP status, or {@link #NO_STATUS}
     */
    public int statusCode() {
        return statusCode;
    }
}
