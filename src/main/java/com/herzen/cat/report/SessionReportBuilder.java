package com.herzen.cat.report;

import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import com.herzen.cat.session.AdaptiveSession;
import com.herzen.cat.session.SessionModels.ItemResponse;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
public class SessionReportBuilder {
    public SessionReport build(AdaptiveSession session) {
        AbilityEstimate ability = session.currentAbility();
        int correct = (int) session.responses().stream().filter(ItemResponse::correct).count();

        Map<String, Double> topicPerformance = session.responses().stream()
                .collect(Collectors.groupingBy(r -> groupKey(session, r.itemId()),
                        TreeMap::new,
                        Collectors.averagingDouble(ItemResponse::score)));

        return new SessionReport(
                session.id(),
                session.learner().name(),
                ability.theta(),
                ability.standardError(),
                correct,
                session.responses().size(),
                session.isComplete(),
                session.completionReason().orElse(null),
                topicPerformance);
    }

    // items without a topic are reported on their own
    private String groupKey(AdaptiveSession session, String itemId) {
        return session.poolItem(itemId)
                .map(ItemTemplate::topic)
                .filter(t -> !t.isBlank())
                .orElse(itemId);
    }
}
