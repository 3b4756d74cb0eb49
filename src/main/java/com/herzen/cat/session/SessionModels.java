package com.herzen.cat.session;

import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import com.herzen.cat.termination.CompletionReason;
import com.herzen.cat.termination.TerminationCriteria;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class SessionModels {
    public enum SessionState { NOT_STARTED, IN_PROGRESS, COMPLETED }

    public record LearnerProfile(String id, String name, List<String> objectives) {
        public LearnerProfile {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("Learner id is required");
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Learner name is required");
            name = name.trim();
            objectives = objectives == null ? List.of() : objectives.stream()
                    .filter(o -> o != null && !o.isBlank())
                    .map(String::trim)
                    .toList();
        }
    }

    public record ItemResponse(String itemId,
                               boolean correct,
                               double score,
                               Duration responseTime,
                               String rawResponse,
                               AbilityEstimate abilityAfter) {}

    public record SessionSnapshot(int schemaVersion,
                                  String sessionId,
                                  LearnerProfile learner,
                                  String topic,
                                  SessionState state,
                                  CompletionReason completionReason,
                                  TerminationCriteria criteria,
                                  List<String> poolItemIds,
                                  List<String> administeredItemIds,
                                  List<ItemResponse> responses,
                                  List<AbilityEstimate> abilityHistory,
                                  String activeItemId,
                                  int stallCount,
                                  Instant startedAt,
                                  Instant completedAt) {
        public static final int CURRENT_SCHEMA_VERSION = 1;
    }
}
