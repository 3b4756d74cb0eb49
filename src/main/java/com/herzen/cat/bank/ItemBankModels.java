package com.herzen.cat.bank;

import com.herzen.cat.irt.IrtModels.ItemParameter;

import java.util.List;

public class ItemBankModels {
    public enum ItemFormat { MULTIPLE_CHOICE, TRUE_FALSE, SHORT_ANSWER }

    public record ItemChoice(String id, String text, boolean correct) {}

    public record ItemTemplate(String id,
                               String stem,
                               List<ItemChoice> choices,
                               ItemFormat format,
                               ItemParameter parameter,
                               String topic,
                               String subtopic,
                               String explanation,
                               String bloomLevel,
                               String learningObjective) {
        public ItemTemplate {
            choices = choices == null ? List.of() : List.copyOf(choices);
            topic = topic == null ? "" : topic.trim();
            subtopic = subtopic == null ? "" : subtopic.trim();
            explanation = explanation == null ? "" : explanation.trim();
            bloomLevel = bloomLevel == null || bloomLevel.isBlank() ? "Apply" : bloomLevel.trim();
            learningObjective = learningObjective == null ? "" : learningObjective.trim();
        }
    }

    public record ImportError(String code, String message, int index, String itemId) {}

    public record ImportResult(boolean dryRun, boolean valid, int itemCount, List<ImportError> errors) {}
}
