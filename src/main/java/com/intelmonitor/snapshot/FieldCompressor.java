package com.intelmonitor.snapshot;

import com.intelmonitor.config.SnapshotStoreConfig;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lossless compression of large serialized snapshot sections.
 *
 * <p>Values whose UTF-8 size exceeds the configured threshold are gzip'd and
 * Base64-encoded behind a {@value #MARKER} prefix. Anything without the prefix is
 * returned unchanged on read, so rows written before compression was enabled (or
 * whose compression failed) stay readable.
 */
@Component
public class FieldCompressor {

    private static final Logger log = LoggerFactory.getLogger(FieldCompressor.class);

    public static final String MARKER = "gz:";

    private final int thresholdBytes;

    public FieldCompressor(SnapshotStoreConfig snapshotStoreConfig) {
        this.thresholdBytes = snapshotStoreConfig.getCompressionThresholdBytes();
    }

    /**
     * Compresses the value when it is larger than the threshold.
     * On failure the value is returned uncompressed.
     */
    public String compressIfLarge(String value) {
        if (value == null) {
            return null;
        }
        byte[] raw = value.getBytes(StandardCharsets.UTF_8);
        if (raw.length <= thresholdBytes) {
            return value;
        }
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream(raw.length / 2);
            try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
                gzip.write(raw);
            }
            String encoded = MARKER + Base64.getEncoder().encodeToString(buffer.toByteArray());
            log.debug("Compressed field {} -> {} bytes", raw.length, encoded.length());
            return encoded;
        } catch (IOException e) {
            log.warn("Field compression failed, storing uncompressed ({} bytes): {}", raw.length, e.getMessage());
            return value;
        }
    }

    /**
     * Restores a value written by {@link #compressIfLarge}. Returns null (and logs a
     * warning) when a marked payload cannot be decoded.
     */
    public String decompress(String stored) {
        if (!isCompressed(stored)) {
            return stored;
        }
        try {
            byte[] compressed = Base64.getDecoder().decode(stored.substring(MARKER.length()));
            try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Field decompression failed, returning empty section: {}", e.getMessage());
            return null;
        }
    }

    public boolean isCompressed(String stored) {
        return stored != null && stored.startsWith(MARKER);
    }

    public int getThresholdBytes() {
        return thresholdBytes;
    }
}
