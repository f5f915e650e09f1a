package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.ChangeType;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single typed, confidence-scored difference between two snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Change {

    private ChangeType changeType;
    private String title;
    private String description;

    /** 0-1. */
    private double confidence;

    private List<String> sourceUrls;
    private LocalDateTime detectedAt;
    private String previousValue;
    private String currentValue;
}
