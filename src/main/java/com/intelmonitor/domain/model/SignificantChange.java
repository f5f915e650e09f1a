package com.intelmonitor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A consecutive-point jump of more than 20% inside an aggregation window.
 * {@code index} is the position of the later point in the window's series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignificantChange {

    private String metric;
    private double changePct;
    private double previous;
    private double current;
    private int index;
}
