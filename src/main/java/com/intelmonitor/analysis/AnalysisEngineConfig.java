package com.intelmonitor.analysis;

import com.intelmonitor.exception.AnalysisEngineException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Placeholder engine used until a real {@link AnalysisEngine} bean is provided.
 * Every call fails, so checks are retried and then dead-lettered rather than
 * recording empty snapshots.
 */
@Configuration
public class AnalysisEngineConfig {

    @Bean
    @ConditionalOnMissingBean(AnalysisEngine.class)
    public AnalysisEngine unconfiguredAnalysisEngine() {
        return request -> {
            throw new AnalysisEngineException("No analysis engine configured; cannot analyze " + request.getCompany());
        };
    }
}
