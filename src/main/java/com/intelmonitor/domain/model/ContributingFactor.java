package com.intelmonitor.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributingFactor {

    private String factor;
    private double confidence;

    /** internal, market, regulatory or technology. */
    private String category;

    /** Titles of the changes that support this factor. */
    private List<String> evidence;
}
