/**
 * Explicit, caller-owned caching of normalized series.
 *
 * @since 1.0.0
 */
package com.atmosight.core.cache;
