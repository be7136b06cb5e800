package feedwatch.monitor;

/**
 * Result of one {@link FeedMonitor#checkSource per-source check}.
 */
public enum CheckOutcome {
    /** The circuit breaker blocked the check; nothing was touched. */
    SKIPPED_CIRCUIT_OPEN,
    /** Another check of the same source was still running. */
    SKIPPED_IN_FLIGHT,
    /** No strategy produced items. */
    FETCH_FAILED,
    /** First successful check; the newest item id was stored without notifying. */
    BASELINE_RECORDED,
    /** The newest item is the one already known. */
    NO_NEW_ITEM,
    /** A new item was found but had already been announced. */
    DUPLICATE_SUPPRESSED,
    /** A new item was found but the source has no destinations. */
    NO_DESTINATIONS,
    /** A new item was handed to the deliverer and recorded in history. */
    DELIVERED,
    /** An unexpected error, typically from storage, ended the check. */
    ERROR;

    /**
     * Whether the check advanced the source's last item id.
     */
    public boolean advanced() {
        return this == BASELINE_RECORDED || this == DUPLICATE_SUPPRESSED
                || this == NO_DESTINATIONS || this == DELIVERED;
    }
}
