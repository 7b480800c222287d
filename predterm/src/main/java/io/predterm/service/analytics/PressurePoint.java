package io.predterm.service.analytics;

/**
 * Buy/sell balance of one time bucket.
 *
 * @param bucketStart epoch millis of the bucket start
 */
public record PressurePoint(long bucketStart, double ratio, double buyVolume, double sellVolume) {
}
