package com.herzen.cat;

import com.herzen.cat.bank.ItemBankModels.ImportResult;
import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.bank.ItemBankService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ItemBankServiceTest {
    @Autowired
    private ItemBankService itemBank;

    @Test
    void importsAndReadsBackByTopic() {
        String topic = "Optics-" + UUID.randomUUID();
        List<ItemTemplate> items = CatFixtures.pool("opt-" + topic, topic);

        ImportResult result = itemBank.importItems(items, false);
        assertTrue(result.valid());
        assertEquals(30, result.itemCount());

        List<ItemTemplate> pool = itemBank.pool(topic.toUpperCase());
        assertEquals(30, pool.size());
        assertEquals(items.get(0).id(), pool.get(0).id());
        assertEquals(items.get(0), itemBank.item(items.get(0).id()).orElseThrow());
        assertTrue(itemBank.topics().contains(topic));
    }

    @Test
    void dryRunValidatesWithoutSaving() {
        String topic = "dry-" + UUID.randomUUID();
        ImportResult result = itemBank.importItems(CatFixtures.pool("dry-" + topic, topic), true);

        assertTrue(result.dryRun());
        assertTrue(result.valid());
        assertTrue(itemBank.pool(topic).isEmpty());
    }

    @Test
    void invalidBatchIsRejectedAsAWhole() {
        String topic = "bad-" + UUID.randomUUID();
        List<ItemTemplate> items = List.of(
                CatFixtures.item(topic + "-1", 0.0, 1.0, 0.2, topic),
                CatFixtures.item(topic + "-2", 0.0, -1.0, 0.2, topic));

        ImportResult result = itemBank.importItems(items, false);

        assertFalse(result.valid());
        assertEquals("INVALID_DISCRIMINATION", result.errors().get(0).code());
        assertTrue(itemBank.pool(topic).isEmpty());
    }

    @Test
    void existingItemsCannotBeOverwritten() {
        String topic = "fixed-" + UUID.randomUUID();
        ItemTemplate original = CatFixtures.item(topic + "-1", -1.3, 1.4, 0.2, topic);
        assertTrue(itemBank.importItems(List.of(original), false).valid());

        ItemTemplate recalibrated = CatFixtures.item(topic + "-1", 3.5, 1.4, 0.2, topic);
        ImportResult dryRun = itemBank.importItems(List.of(recalibrated), true);
        ImportResult result = itemBank.importItems(List.of(recalibrated), false);

        assertFalse(dryRun.valid());
        assertFalse(result.valid());
        assertEquals("ITEM_EXISTS", result.errors().get(0).code());
        assertEquals(topic + "-1", result.errors().get(0).itemId());
        assertEquals(-1.3, itemBank.item(topic + "-1").orElseThrow().parameter().difficulty());
    }

    @Test
    void emptyImportIsNotValid() {
        assertFalse(itemBank.importItems(List.of(), false).valid());
        assertFalse(itemBank.importItems(null, true).valid());
    }
}
