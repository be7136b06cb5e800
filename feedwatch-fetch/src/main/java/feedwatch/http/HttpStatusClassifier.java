package feedwatch.http;

import feedwatch.FetchException;
import feedwatch.PermanentFetchException;
import feedwatch.TransientFetchException;

/**
 * Maps a non-2xx HTTP status to the fetch failure taxonomy.
 *
 * <ul>
 *   <li>5xx and 429 are transient.</li>
 *   <li>Every other status is permanent: the upstream will give the same answer on retry.</li>
 * </ul>
 */
public final class HttpStatusClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private HttpStatusClassifier() {
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    public static boolean isRetryable(int status) {
        return status >= 500 || status == TOO_MANY_REQUESTS;
    }

    public static FetchException toException(int status, String target) {
        String message = "HTTP " + status + " from " + target;
        return isRetryable(status)
                ? new TransientFetchException(message, status)
                : new PermanentFetchException(message, status);
    }
}
