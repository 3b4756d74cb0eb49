package com.herzen.cat.session;

import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.config.CatEngineProperties;
import com.herzen.cat.irt.AbilityEstimator;
import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import com.herzen.cat.selection.ItemSelector;
import com.herzen.cat.session.SessionModels.SessionSnapshot;
import com.herzen.cat.termination.TerminationCriteria;
import com.herzen.cat.termination.TerminationEvaluator;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.UUID;

@Component
public class CatEngine {
    private final ItemSelector selector;
    private final AbilityEstimator estimator;
    private final TerminationEvaluator evaluator;
    private final CatEngineProperties properties;

    public CatEngine(ItemSelector selector,
                     AbilityEstimator estimator,
                     TerminationEvaluator evaluator,
                     CatEngineProperties properties) {
        this.selector = selector;
        this.estimator = estimator;
        this.evaluator = evaluator;
        this.properties = properties;
    }

    public AdaptiveSession newSession() {
        return new AdaptiveSession(UUID.randomUUID().toString(), this);
    }

    public AdaptiveSession restore(SessionSnapshot snapshot, Collection<ItemTemplate> pool) {
        return AdaptiveSession.restore(snapshot, pool, this);
    }

    public AbilityEstimate initialEstimate() {
        return AbilityEstimate.prior(properties.getPriorTheta(), properties.getPriorStandardError());
    }

    public TerminationCriteria defaultCriteria() {
        return properties.getDefaultCriteria().toCriteria();
    }

    public double stallEpsilon() {
        return properties.getStallEpsilon();
    }

    ItemSelector selector() {
        return selector;
    }

    AbilityEstimator estimator() {
        return estimator;
    }

    TerminationEvaluator evaluator() {
        return evaluator;
    }
}
