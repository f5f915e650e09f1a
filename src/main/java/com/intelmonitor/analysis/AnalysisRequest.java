package com.intelmonitor.analysis;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    private String company;
    private String industry;

    /** Framework keys, e.g. "porter", "swot". */
    private List<String> frameworks;

    private String depth;
}
