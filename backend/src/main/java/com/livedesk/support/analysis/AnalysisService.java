package com.livedesk.support.analysis;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs analysis for one unit and never fails: a degraded outcome is replaced with its fallback analysis.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisClient analysisClient;
    private final MeterRegistry meterRegistry;

    public AnalysisService(AnalysisClient analysisClient, MeterRegistry meterRegistry) {
        this.analysisClient = analysisClient;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        AnalysisOutcome outcome;
        try {
            outcome = analysisClient.analyze(request);
        } catch (RuntimeException ex) {
            log.warn("analysis_client_threw kind={} error={}", request.kind(), ex.toString());
            outcome = AnalysisOutcome.failure(AnalysisFailure.API_ERROR, ex.toString());
        }
        if (outcome == null) {
            outcome = AnalysisOutcome.failure(AnalysisFailure.API_ERROR, "null_outcome");
        }

        if (outcome instanceof AnalysisOutcome.Success success) {
            return success.analysis();
        }

        var failure = (AnalysisOutcome.Failure) outcome;
        log.warn("analysis_degraded kind={} detail={}", failure.kind().marker(), failure.detail());
        Counter.builder("livedesk.analysis.degraded")
                .description("Analyses replaced by a fallback")
                .tag("kind", failure.kind().marker())
                .register(meterRegistry)
                .increment();
        return FallbackAnalyses.forFailure(failure.kind(), request.kind());
    }
}
