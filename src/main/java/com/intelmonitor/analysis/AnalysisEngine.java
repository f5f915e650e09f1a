package com.intelmonitor.analysis;

import com.intelmonitor.domain.model.AnalysisResult;

/**
 * Produces a fresh strategic analysis of a company. Implemented outside the engine
 * (research agents, LLM pipeline, data vendors).
 *
 * <p>Implementations signal transient upstream failures with
 * {@link com.intelmonitor.exception.AnalysisEngineException}, which the task queue retries.
 */
public interface AnalysisEngine {

    AnalysisResult analyze(AnalysisRequest request);
}
