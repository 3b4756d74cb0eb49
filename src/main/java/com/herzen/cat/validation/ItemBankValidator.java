package com.herzen.cat.validation;

import com.herzen.cat.bank.ItemBankModels.ImportError;
import com.herzen.cat.bank.ItemBankModels.ItemChoice;
import com.herzen.cat.bank.ItemBankModels.ItemFormat;
import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.irt.IrtModels.ItemParameter;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ItemBankValidator {
    public List<ImportError> validate(List<ItemTemplate> items) {
        List<ImportError> errors = new ArrayList<>();
        if (items == null) return errors;

        Map<String, Long> counts = items.stream()
                .filter(Objects::nonNull)
                .map(ItemTemplate::id)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(id -> id, Collectors.counting()));

        for (int i = 0; i < items.size(); i++) {
            ItemTemplate item = items.get(i);
            if (item == null) {
                errors.add(new ImportError("EMPTY_ITEM", "Item entry is empty", i, null));
                continue;
            }
            String id = item.id();
            if (id == null || id.isBlank()) {
                errors.add(new ImportError("MISSING_ID", "Item has no id", i, id));
            } else if (counts.getOrDefault(id, 0L) > 1) {
                errors.add(new ImportError("DUPLICATE_ITEM", "Duplicate item id: " + id, i, id));
            }
            if (item.stem() == null || item.stem().isBlank()) {
                errors.add(new ImportError("MISSING_STEM", "Item has no stem", i, id));
            }
            if (item.format() == null) {
                errors.add(new ImportError("MISSING_FORMAT", "Item has no format", i, id));
            } else if (item.format() == ItemFormat.MULTIPLE_CHOICE) {
                if (item.choices().isEmpty()) {
                    errors.add(new ImportError("MISSING_CHOICES", "Multiple choice item requires at least one choice", i, id));
                } else if (item.choices().stream().noneMatch(ItemChoice::correct)) {
                    errors.add(new ImportError("NO_CORRECT_CHOICE", "Multiple choice item has no correct choice", i, id));
                }
            }
            validateParameter(item.parameter(), i, id, errors);
        }
        return errors;
    }

    private void validateParameter(ItemParameter parameter, int index, String id, List<ImportError> errors) {
        if (parameter == null) {
            errors.add(new ImportError("MISSING_PARAMETER", "Item has no IRT parameters", index, id));
            return;
        }
        if (!Double.isFinite(parameter.difficulty())) {
            errors.add(new ImportError("INVALID_DIFFICULTY", "Difficulty must be finite: " + parameter.difficulty(), index, id));
        }
        if (!(parameter.discrimination() > 0) || !Double.isFinite(parameter.discrimination())) {
            errors.add(new ImportError("INVALID_DISCRIMINATION", "Discrimination must be positive: " + parameter.discrimination(), index, id));
        }
        if (!(parameter.guessing() >= 0 && parameter.guessing() < 1)) {
            errors.add(new ImportError("INVALID_GUESSING", "Guessing must be in [0,1): " + parameter.guessing(), index, id));
        }
    }
}
