package com.livedesk.support.analysis;

public interface AnalysisClient {

    /**
     * Expected failures come back as {@link AnalysisOutcome.Failure}; this should not throw.
     */
    AnalysisOutcome analyze(AnalysisRequest request);
}
