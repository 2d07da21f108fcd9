package com.livedesk.support.analysis;

public sealed interface AnalysisOutcome {

    record Success(AnalysisResult analysis) implements AnalysisOutcome {
    }

    record Failure(AnalysisFailure kind, String detail) implements AnalysisOutcome {
    }

    static AnalysisOutcome success(AnalysisResult analysis) {
        return new Success(analysis);
    }

    static AnalysisOutcome failure(AnalysisFailure kind, String detail) {
        return new Failure(kind, detail);
    }
}
