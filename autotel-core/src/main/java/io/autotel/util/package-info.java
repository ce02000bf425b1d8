/**
 * Internal helpers.
 */
package io.autotel.util;
