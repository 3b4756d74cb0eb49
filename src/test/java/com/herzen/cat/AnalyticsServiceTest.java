package com.herzen.cat;

import com.herzen.cat.analytics.AnalyticsModels.ItemExposureResponse;
import com.herzen.cat.analytics.AnalyticsModels.LearningEvent;
import com.herzen.cat.analytics.AnalyticsService;
import com.herzen.cat.analytics.LearningEventTypes;
import com.herzen.cat.bank.ItemBankService;
import com.herzen.cat.service.AdaptiveTestService;
import com.herzen.cat.service.AdaptiveTestService.ResponseSubmission;
import com.herzen.cat.session.SessionModels.LearnerProfile;
import com.herzen.cat.termination.TerminationCriteria;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AnalyticsServiceTest {
    @Autowired
    private ItemBankService itemBank;

    @Autowired
    private AdaptiveTestService testService;

    @Autowired
    private AnalyticsService analyticsService;

    private String runSession(String topic, String learnerId, int items) {
        String sessionId = testService.startSession(new LearnerProfile(learnerId, "Learner", List.of()), topic,
                new TerminationCriteria(0.0, items, null, 100)).sessionId();
        for (int i = 0; i < items; i++) {
            String itemId = testService.nextItem(sessionId).orElseThrow().id();
            testService.submitResponse(sessionId, new ResponseSubmission(itemId, i % 2 == 1, null, 1000L, ""));
        }
        return sessionId;
    }

    @Test
    void timelineFollowsSessionLifecycle() {
        String topic = "timeline-" + UUID.randomUUID();
        itemBank.importItems(CatFixtures.pool(topic, topic), false);

        String sessionId = runSession(topic, "learner-timeline", 2);

        List<String> types = analyticsService.timeline(sessionId).events().stream()
                .map(LearningEvent::eventType)
                .toList();
        assertEquals(List.of(
                LearningEventTypes.SESSION_START,
                LearningEventTypes.ITEM_PRESENTED,
                LearningEventTypes.RESPONSE_RECORDED,
                LearningEventTypes.ITEM_PRESENTED,
                LearningEventTypes.RESPONSE_RECORDED,
                LearningEventTypes.SESSION_COMPLETE), types);
    }

    @Test
    void exposureCountsAdministrationsPerStartedSession() {
        String topic = "exposure-" + UUID.randomUUID();
        itemBank.importItems(CatFixtures.pool(topic, topic), false);

        runSession(topic, "learner-a", 3);
        runSession(topic, "learner-b", 3);

        ItemExposureResponse exposure = analyticsService.itemExposure(topic);

        assertEquals(2, exposure.sessionsStarted());
        assertFalse(exposure.items().isEmpty());
        // both sessions begin at the prior, so their first item is the same
        assertEquals(2, exposure.items().get(0).administrations());
        assertEquals(1.0, exposure.items().get(0).exposureRate(), 1e-9);
        assertEquals(6, exposure.items().stream().mapToLong(r -> r.administrations()).sum());
    }

    @Test
    void unsupportedEventTypeIsDropped() {
        String sessionId = "manual-" + UUID.randomUUID();
        analyticsService.record(sessionId, "learner", "t", null, "made_up", null);
        analyticsService.record(sessionId, "learner", "t", "i-1", LearningEventTypes.ITEM_PRESENTED, null);

        assertEquals(1, analyticsService.timeline(sessionId).events().size());
    }
}
