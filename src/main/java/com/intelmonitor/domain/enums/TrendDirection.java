package com.intelmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    STABLE("stable"),
    /** Fit too poor to call a direction. Only series trend detection reports it. */
    VOLATILE("volatile");

    private final String label;
}
