package io.autotel.dispatch;

/**
 * Computes the pause before a retry round for events a subscriber failed to accept.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /** Retries immediately. */
    RetryPolicy IMMEDIATE = round -> 0L;

    /**
     * Computes the delay in milliseconds before the given retry round.
     *
     * @param round the retry round (1 for the first retry)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int round);
}
