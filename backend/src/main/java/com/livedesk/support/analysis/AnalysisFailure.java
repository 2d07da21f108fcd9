package com.livedesk.support.analysis;

public enum AnalysisFailure {
    /** No model configured. */
    UNAVAILABLE("system_error"),
    /** The model answered but the answer is not the expected JSON. */
    MALFORMED_OUTPUT("parsing_error"),
    /** Transport error, timeout, non-2xx status or no candidates. */
    API_ERROR("api_error");

    private final String marker;

    AnalysisFailure(String marker) {
        this.marker = marker;
    }

    /**
     * The reserved intent value substituted when analysis degrades.
     */
    public String marker() {
        return marker;
    }
}
