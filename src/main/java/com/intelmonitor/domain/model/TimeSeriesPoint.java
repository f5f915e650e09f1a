package com.intelmonitor.domain.model;

import java.time.LocalDateTime;

/** One observation of a numeric metric. */
public record TimeSeriesPoint(LocalDateTime timestamp, double value) {}
