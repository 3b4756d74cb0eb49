package com.herzen.cat.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.herzen.cat.termination.CompletionReason;

import java.util.Map;

public record SessionReport(String sessionId,
                            String learnerName,
                            double finalAbility,
                            double standardError,
                            int correctCount,
                            int totalCount,
                            @JsonProperty("isComplete") boolean complete,
                            CompletionReason completionReason,
                            Map<String, Double> topicPerformance) {

    @JsonProperty("accuracyPercent")
    public double accuracyPercent() {
        return totalCount > 0 ? (double) correctCount / totalCount * 100 : 0.0;
    }
}
