package com.herzen.cat.api;

import com.herzen.cat.bank.ItemBankModels;
import com.herzen.cat.bank.ItemBankService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/items")
public class ItemBankController {
    private final ItemBankService itemBankService;

    public ItemBankController(ItemBankService itemBankService) {
        this.itemBankService = itemBankService;
    }

    @PostMapping("/import")
    public ResponseEntity<ItemBankModels.ImportResult> importItems(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(itemBankService.importItems(request.items(), request.dryRun()));
    }

    @GetMapping
    public ResponseEntity<List<ItemBankModels.ItemTemplate>> pool(@RequestParam(required = false) String topic) {
        return ResponseEntity.ok(itemBankService.pool(topic));
    }

    @GetMapping("/topics")
    public ResponseEntity<List<String>> topics() {
        return ResponseEntity.ok(itemBankService.topics());
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<ItemBankModels.ItemTemplate> item(@PathVariable String itemId) {
        return itemBankService.item(itemId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record ImportRequest(List<ItemBankModels.ItemTemplate> items, boolean dryRun) {}
}
