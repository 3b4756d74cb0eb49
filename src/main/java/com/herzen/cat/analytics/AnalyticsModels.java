package com.herzen.cat.analytics;

import java.time.Instant;
import java.util.List;

public class AnalyticsModels {
    public record LearningEvent(String sessionId,
                                String learnerId,
                                String topic,
                                String itemId,
                                String eventType,
                                Instant ts,
                                String payload) {}

    public record ItemExposureRow(String itemId, long administrations, double exposureRate) {}

    public record ItemExposureResponse(String topic, long sessionsStarted, List<ItemExposureRow> items) {}

    public record SessionTimelineResponse(String sessionId, List<LearningEvent> events) {}
}
