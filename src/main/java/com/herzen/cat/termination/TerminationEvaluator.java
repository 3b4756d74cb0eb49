package com.herzen.cat.termination;

import com.herzen.cat.config.CatEngineProperties;
import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class TerminationEvaluator {
    private final int minItemsForMastery;

    public TerminationEvaluator(CatEngineProperties properties) {
        this.minItemsForMastery = properties.getMinItemsForMastery();
    }

    public boolean shouldStop(AbilityEstimate ability, int itemsAdministered, int stallCount, TerminationCriteria criteria) {
        return evaluate(ability, itemsAdministered, stallCount, criteria).isPresent();
    }

    public Optional<CompletionReason> evaluate(AbilityEstimate ability, int itemsAdministered, int stallCount, TerminationCriteria criteria) {
        if (itemsAdministered >= criteria.maxItems()) {
            return Optional.of(CompletionReason.MAX_ITEMS);
        }
        if (ability.standardError() <= criteria.targetStandardError()) {
            return Optional.of(CompletionReason.TARGET_STANDARD_ERROR);
        }
        // a lucky start must not end the test
        if (criteria.masteryTheta() != null
                && itemsAdministered >= minItemsForMastery
                && ability.theta() >= criteria.masteryTheta()) {
            return Optional.of(CompletionReason.MASTERY);
        }
        if (stallCount >= criteria.maxStallCount()) {
            return Optional.of(CompletionReason.STALLED);
        }
        return Optional.empty();
    }
}
