package com.intelmonitor.domain.enums;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Strategy frameworks the analysis engine can apply. The key is the wire name
 * sent to the engine and stored in monitor settings.
 */
@Getter
@RequiredArgsConstructor
public enum AnalysisFramework {
    PORTER("porter"),
    SWOT("swot"),
    PESTEL("pestel"),
    BLUE_OCEAN("blue_ocean"),
    ANSOFF("ansoff"),
    BCG_MATRIX("bcg_matrix"),
    VALUE_CHAIN("value_chain");

    private final String key;

    public static Optional<AnalysisFramework> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(f -> f.key.equals(normalized)).findFirst();
    }
}
