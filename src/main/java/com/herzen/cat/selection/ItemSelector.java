package com.herzen.cat.selection;

import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.irt.ProbabilityModel;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Component
public class ItemSelector {
    private final ProbabilityModel model;

    public ItemSelector(ProbabilityModel model) {
        this.model = model;
    }

    public Optional<ItemTemplate> selectNext(Collection<ItemTemplate> pool, Set<String> administeredIds, double theta) {
        ItemTemplate best = null;
        double bestInfo = Double.NEGATIVE_INFINITY;
        for (ItemTemplate item : pool) {
            if (administeredIds.contains(item.id())) continue;
            double info = model.fisherInformation(item.parameter(), theta);
            if (best == null || info > bestInfo || (info == bestInfo && item.id().compareTo(best.id()) < 0)) {
                best = item;
                bestInfo = info;
            }
        }
        return Optional.ofNullable(best);
    }
}
