/**
 * Per-subscriber health flags.
 */
package io.autotel.health;
