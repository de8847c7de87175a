package com.partner.match.metrics;

import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.utils.basic.Constant;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class MatchingMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary overallScoreSummary;


    public MatchingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.overallScoreSummary = DistributionSummary.builder("match_overall_score")
                .description("Overall compatibility score of ranked candidates")
                .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordMatchingDuration(Timer.Sample sample, int resultCount) {
        sample.stop(meterRegistry.timer("matching_duration", Constant.RESULT_COUNT_TAG, bucket(resultCount)));
    }

    public void recordOverallScore(double score) {
        overallScoreSummary.record(score);
    }

    public void recordCandidates(int considered, int eligible) {
        meterRegistry.counter("match_candidates_considered").increment(considered);
        meterRegistry.counter("match_candidates_filtered").increment(Math.max(0, considered - eligible));
    }

    public void recordCacheHit() {
        meterRegistry.counter("match_cache_requests", Constant.OUTCOME_TAG, "hit").increment();
    }

    public void recordCacheMiss() {
        meterRegistry.counter("match_cache_requests", Constant.OUTCOME_TAG, "miss").increment();
    }

    public void recordScheduleSlots(int slotCount) {
        meterRegistry.counter("schedule_slots_found").increment(slotCount);
    }

    public void recordRecommendations(RecommendationMethod method, int count) {
        meterRegistry.counter("recommendations_generated", Constant.METHOD_TAG, method.name().toLowerCase()).increment(count);
    }

    private String bucket(int resultCount) {
        if (resultCount == 0) return "0";
        if (resultCount <= 10) return "1-10";
        return "10+";
    }
}
