package com.intelmonitor.exception;

/**
 * Raised when the upstream analysis engine fails or times out. Retryable.
 */
public class AnalysisEngineException extends BaseException {

    public AnalysisEngineException(String message) {
        super(ErrorCode.ANALYSIS_FAILED, message);
    }

    public AnalysisEngineException(String message, Throwable cause) {
        super(ErrorCode.ANALYSIS_FAILED, message, cause);
    }
}
