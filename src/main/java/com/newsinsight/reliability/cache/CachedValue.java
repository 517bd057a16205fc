package com.newsinsight.reliability.cache;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cache entry stamped with its write instant.
 */
public record CachedValue<V>(V value, Instant writtenAt) implements Serializable {
}
