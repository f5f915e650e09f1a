package com.intelmonitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the snapshot store.
 *
 * <p>Controls field compression, write batching, the range-query cache and retention.
 */
@Configuration
@ConfigurationProperties(prefix = "intelmonitor.snapshot-store")
@Getter
@Setter
public class SnapshotStoreConfig {

    /** Serialized field size in bytes above which the field is gzip-compressed. */
    private int compressionThresholdBytes = 1024;

    /** Number of buffered snapshots that triggers a batched write. */
    private int batchSize = 10;

    /** Interval for draining partially filled write batches, in milliseconds. */
    private long flushIntervalMs = 30_000;

    /** Time-to-live of cached range queries, in seconds. */
    private long cacheTtlSeconds = 300;

    /** Maximum number of cached range queries. */
    private long cacheMaxEntries = 1000;

    /** Snapshots older than this many days are removed by the retention job. */
    private int retentionDays = 90;
}
