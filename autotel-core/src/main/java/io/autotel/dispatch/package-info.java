/**
 * Per-subscriber delivery: retry rounds, retry backoff and rate limiting.
 *
 * @see io.autotel.dispatch.SubscriberChannel
 * @see io.autotel.dispatch.RetryPolicy
 */
package io.autotel.dispatch;
