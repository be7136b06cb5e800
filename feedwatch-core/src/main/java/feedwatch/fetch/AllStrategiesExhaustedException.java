package feedwatch.fetch;

/**
 * Thrown by {@link FetchStrategyChain#requireLatestItems} when no strategy produced items.
 *
 * <p>The failure of each strategy that threw is attached as a suppressed exception.
 */
public class AllStrategiesExhaustedException extends RuntimeException {
    private final String handle;

    public AllStrategiesExhaustedException(String handle) {
        super("All fetch strategies failed for " + handle);
        this.handle = handle;
    }

    public String handle() {
        return handle;
    }
}
