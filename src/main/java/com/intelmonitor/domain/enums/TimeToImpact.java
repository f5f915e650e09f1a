package com.intelmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TimeToImpact {
    IMMEDIATE("immediate"),
    SHORT_TERM("short-term"),
    MEDIUM_TERM("medium-term");

    private final String label;
}
