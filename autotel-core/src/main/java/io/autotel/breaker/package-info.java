/**
 * Circuit breaker guarding calls to a single subscriber.
 *
 * @see io.autotel.breaker.CircuitBreaker
 */
package io.autotel.breaker;
