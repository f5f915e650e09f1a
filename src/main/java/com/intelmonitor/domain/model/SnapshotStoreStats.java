package com.intelmonitor.domain.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SnapshotStoreStats {

    private int pendingWrites;
    private long cachedQueries;
    private int batchSize;
    private int compressionThresholdBytes;
    private long cacheTtlSeconds;
    private long totalSnapshotsWritten;
    private long compressedFieldsWritten;
}
