package feedwatch.breaker;

/**
 * State of one circuit.
 *
 * <ul>
 *   <li>{@link #CLOSED}: calls pass through.</li>
 *   <li>{@link #OPEN}: calls are blocked until the reset timeout elapses.</li>
 *   <li>{@link #HALF_OPEN}: a single trial call is in progress.</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
