package com.herzen.cat.analytics;

import com.herzen.cat.analytics.AnalyticsModels.*;
import com.herzen.cat.repository.AnalyticsJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Service
public class AnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final AnalyticsJdbcRepository repository;

    public AnalyticsService(AnalyticsJdbcRepository repository) {
        this.repository = repository;
    }

    public void record(String sessionId, String learnerId, String topic, String itemId, String eventType, String payload) {
        if (!LearningEventTypes.SUPPORTED.contains(eventType)) {
            log.warn("Dropping unsupported event type {} for session {}", eventType, sessionId);
            return;
        }
        repository.saveEvents(List.of(new LearningEvent(sessionId, learnerId, topic, itemId, eventType, Instant.now(), payload)));
    }

    public ItemExposureResponse itemExposure(String topic) {
        String filter = topic == null || topic.isBlank() ? null : topic.trim();
        long sessions = repository.countEvents(LearningEventTypes.SESSION_START, filter);
        List<ItemExposureRow> rows = repository.countByItem(LearningEventTypes.RESPONSE_RECORDED, filter).stream()
                .map(r -> new ItemExposureRow(r.itemId(), r.count(), sessions == 0 ? 0.0 : (double) r.count() / sessions))
                .sorted(Comparator.comparingLong(ItemExposureRow::administrations).reversed()
                        .thenComparing(ItemExposureRow::itemId))
                .toList();
        return new ItemExposureResponse(filter, sessions, rows);
    }

    public SessionTimelineResponse timeline(String sessionId) {
        return new SessionTimelineResponse(sessionId, repository.loadSessionEvents(sessionId));
    }
}
