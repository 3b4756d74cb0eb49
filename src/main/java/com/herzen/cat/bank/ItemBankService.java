package com.herzen.cat.bank;

import com.herzen.cat.bank.ItemBankModels.*;
import com.herzen.cat.repository.ItemBankJdbcRepository;
import com.herzen.cat.validation.ItemBankValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class ItemBankService {
    private static final Logger log = LoggerFactory.getLogger(ItemBankService.class);

    private final ItemBankJdbcRepository repository;
    private final ItemBankValidator validator;

    public ItemBankService(ItemBankJdbcRepository repository, ItemBankValidator validator) {
        this.repository = repository;
        this.validator = validator;
    }

    public ImportResult importItems(List<ItemTemplate> items, boolean dryRun) {
        List<ItemTemplate> batch = items == null ? List.of() : items;
        List<ImportError> errors = new ArrayList<>(validator.validate(batch));
        // calibrated items are immutable once sessions can reference them
        for (int i = 0; i < batch.size(); i++) {
            ItemTemplate item = batch.get(i);
            if (item != null && item.id() != null && !item.id().isBlank() && repository.exists(item.id())) {
                errors.add(new ImportError("ITEM_EXISTS", "Item already exists in the bank: " + item.id(), i, item.id()));
            }
        }
        boolean valid = errors.isEmpty() && !batch.isEmpty();
        if (valid && !dryRun) {
            repository.saveAll(batch);
            log.info("Imported {} items into the item bank", batch.size());
        } else if (!errors.isEmpty()) {
            log.warn("Rejected item import with {} errors", errors.size());
        }
        return new ImportResult(dryRun, valid, batch.size(), errors);
    }

    public List<ItemTemplate> pool(String topic) {
        return topic == null || topic.isBlank() ? repository.findAll() : repository.findByTopic(topic);
    }

    public Optional<ItemTemplate> item(String itemId) {
        return repository.findById(itemId);
    }

    public List<String> topics() {
        return repository.topics();
    }
}
