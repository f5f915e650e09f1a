package com.intelmonitor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recommended action with owner and timeline placeholders, e.g.
 * priority "1 - URGENT", owner "Strategy Team", timeline "24-48 hours".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrioritizedAction {

    private String priority;
    private String action;
    private String owner;
    private String timeline;
}
