package io.autotel.breaker;

/**
 * Thrown by {@link CircuitBreaker#execute} when the circuit is open and the protected
 * action was not invoked.
 *
 * <p>Not a delivery failure: callers must not count it as a retry attempt.
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final long retryInMs;

    /**
     * @param breakerName name of the breaker that rejected the call
     * @param retryInMs   milliseconds until the next trial call is allowed (0 if a trial is in flight)
     */
    public CircuitOpenException(String breakerName, long retryInMs) {
        super("Circuit breaker is OPEN for " + breakerName + ". Will retry in "
                + (long) Math.ceil(retryInMs / 1000.0) + "s");
        this.breakerName = breakerName;
        this.retryInMs = retryInMs;
    }

    public String breakerName() {
        return breakerName;
    }

    public long retryInMs() {
        return retryInMs;
    }
}
