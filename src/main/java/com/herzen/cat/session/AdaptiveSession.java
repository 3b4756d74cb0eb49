package com.herzen.cat.session;

import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.exception.InvalidSessionStateException;
import com.herzen.cat.exception.ItemPoolEmptyException;
import com.herzen.cat.exception.SnapshotIncompatibleException;
import com.herzen.cat.exception.UnknownOrDuplicateItemException;
import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import com.herzen.cat.irt.IrtModels.EstimationResult;
import com.herzen.cat.irt.IrtModels.ResponseObservation;
import com.herzen.cat.session.SessionModels.*;
import com.herzen.cat.termination.CompletionReason;
import com.herzen.cat.termination.TerminationCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

// Not thread-safe; callers keep a single writer per session.
public class AdaptiveSession {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveSession.class);

    private final String id;
    private final CatEngine engine;

    private SessionState state = SessionState.NOT_STARTED;
    private LearnerProfile learner;
    private String topic;
    private TerminationCriteria criteria;
    private List<ItemTemplate> itemPool = List.of();
    private Map<String, ItemTemplate> poolById = Map.of();
    private final List<String> administeredItemIds = new ArrayList<>();
    private final List<ItemResponse> responses = new ArrayList<>();
    private final List<AbilityEstimate> abilityHistory = new ArrayList<>();
    private String activeItemId;
    private int stallCount;
    private CompletionReason completionReason;
    private Instant startedAt;
    private Instant completedAt;

    public AdaptiveSession(String id, CatEngine engine) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Session id is required");
        this.id = id;
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public void start(LearnerProfile learner, List<ItemTemplate> itemPool, TerminationCriteria criteria) {
        start(learner, null, itemPool, criteria);
    }

    public void start(LearnerProfile learner, String topic, List<ItemTemplate> itemPool, TerminationCriteria criteria) {
        requireState(SessionState.NOT_STARTED, "start session");
        Objects.requireNonNull(learner, "learner");
        if (itemPool == null || itemPool.isEmpty()) {
            throw new ItemPoolEmptyException(topic);
        }
        Map<String, ItemTemplate> byId = indexPool(itemPool);

        this.learner = learner;
        this.topic = topic;
        this.criteria = criteria == null ? engine.defaultCriteria() : criteria;
        this.itemPool = List.copyOf(itemPool);
        this.poolById = byId;
        this.abilityHistory.add(engine.initialEstimate());
        this.startedAt = Instant.now();
        this.state = SessionState.IN_PROGRESS;
        checkInvariants();
        log.info("Session {} started for learner {} with {} items", id, learner.id(), itemPool.size());
    }

    public Optional<ItemTemplate> advanceToNextItem() {
        requireState(SessionState.IN_PROGRESS, "advance to next item");
        Optional<ItemTemplate> next = engine.selector()
                .selectNext(itemPool, new HashSet<>(administeredItemIds), currentAbility().theta());
        if (next.isEmpty()) {
            complete(CompletionReason.POOL_EXHAUSTED);
        } else {
            activeItemId = next.get().id();
        }
        return next;
    }

    public ItemResponse recordResponse(String itemId, boolean correct, double score, Duration responseTime, String rawResponse) {
        requireState(SessionState.IN_PROGRESS, "record response");
        checkInvariants();
        ItemTemplate item = itemId == null ? null : poolById.get(itemId);
        if (item == null) {
            throw new UnknownOrDuplicateItemException(itemId, "Item " + itemId + " is not part of session " + id);
        }
        if (administeredItemIds.contains(itemId)) {
            throw new UnknownOrDuplicateItemException(itemId, "Item " + itemId + " was already answered in session " + id);
        }
        if (!itemId.equals(activeItemId)) {
            throw new UnknownOrDuplicateItemException(itemId, activeItemId == null
                    ? "No item is currently offered in session " + id
                    : "Item " + itemId + " was not offered in session " + id + ", expected " + activeItemId);
        }
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("Score must be within [0,1]: " + score);
        }

        List<ResponseObservation> observations = new ArrayList<>(responses.size() + 1);
        for (ItemResponse r : responses) {
            observations.add(new ResponseObservation(poolById.get(r.itemId()).parameter(), r.correct()));
        }
        observations.add(new ResponseObservation(item.parameter(), correct));

        AbilityEstimate previous = currentAbility();
        EstimationResult result = engine.estimator().estimate(observations, abilityHistory.get(0));
        AbilityEstimate updated = result.estimate();
        int nextStallCount = Math.abs(updated.theta() - previous.theta()) < engine.stallEpsilon() ? stallCount + 1 : 0;
        ItemResponse response = new ItemResponse(itemId, correct, score,
                responseTime == null ? Duration.ZERO : responseTime, rawResponse == null ? "" : rawResponse, updated);
        Optional<CompletionReason> stop = engine.evaluator()
                .evaluate(updated, administeredItemIds.size() + 1, nextStallCount, criteria);

        administeredItemIds.add(itemId);
        responses.add(response);
        abilityHistory.add(updated);
        activeItemId = null;
        stallCount = nextStallCount;
        checkInvariants();

        log.debug("Session {} item {} correct={} theta {} -> {} (se={}, method={})",
                id, itemId, correct, previous.theta(), updated.theta(), updated.standardError(), updated.method());
        stop.ifPresent(this::complete);
        return response;
    }

    public SessionSnapshot snapshot() {
        if (state == SessionState.NOT_STARTED) {
            throw new InvalidSessionStateException(id, state, "snapshot session");
        }
        return new SessionSnapshot(
                SessionSnapshot.CURRENT_SCHEMA_VERSION,
                id,
                learner,
                topic,
                state,
                completionReason,
                criteria,
                itemPool.stream().map(ItemTemplate::id).toList(),
                List.copyOf(administeredItemIds),
                List.copyOf(responses),
                List.copyOf(abilityHistory),
                activeItemId,
                stallCount,
                startedAt,
                completedAt);
    }

    // pool may be a superset of the snapshot's pool ids
    public static AdaptiveSession restore(SessionSnapshot snapshot, Collection<ItemTemplate> pool, CatEngine engine) {
        if (snapshot.schemaVersion() != SessionSnapshot.CURRENT_SCHEMA_VERSION) {
            throw new SnapshotIncompatibleException("Unsupported snapshot schema version " + snapshot.schemaVersion());
        }
        if (snapshot.state() == null || snapshot.state() == SessionState.NOT_STARTED) {
            throw new SnapshotIncompatibleException("Snapshot of session " + snapshot.sessionId() + " has no started state");
        }
        if (snapshot.state() == SessionState.COMPLETED && snapshot.completionReason() == null) {
            throw new SnapshotIncompatibleException("Completed session " + snapshot.sessionId() + " has no completion reason");
        }
        if (snapshot.poolItemIds() == null || snapshot.poolItemIds().isEmpty()) {
            throw new SnapshotIncompatibleException("Snapshot of session " + snapshot.sessionId() + " has an empty item pool");
        }

        Map<String, ItemTemplate> available = new HashMap<>();
        pool.forEach(item -> available.put(item.id(), item));
        List<ItemTemplate> sessionPool = new ArrayList<>();
        for (String itemId : snapshot.poolItemIds()) {
            ItemTemplate item = available.get(itemId);
            if (item == null) {
                throw new SnapshotIncompatibleException("Item " + itemId + " of session " + snapshot.sessionId() + " is no longer in the item bank");
            }
            sessionPool.add(item);
        }

        AdaptiveSession session = new AdaptiveSession(snapshot.sessionId(), engine);
        try {
            session.learner = Objects.requireNonNull(snapshot.learner(), "learner");
            session.criteria = Objects.requireNonNull(snapshot.criteria(), "criteria");
            session.poolById = indexPool(sessionPool);
        } catch (RuntimeException e) {
            throw new SnapshotIncompatibleException("Snapshot of session " + snapshot.sessionId() + " is malformed", e);
        }
        session.topic = snapshot.topic();
        session.itemPool = List.copyOf(sessionPool);
        session.administeredItemIds.addAll(nullToEmpty(snapshot.administeredItemIds()));
        session.responses.addAll(nullToEmpty(snapshot.responses()));
        session.abilityHistory.addAll(nullToEmpty(snapshot.abilityHistory()));
        session.activeItemId = snapshot.activeItemId();
        session.stallCount = snapshot.stallCount();
        session.completionReason = snapshot.completionReason();
        session.startedAt = snapshot.startedAt();
        session.completedAt = snapshot.completedAt();
        session.state = snapshot.state();

        try {
            session.checkInvariants();
        } catch (RuntimeException e) {
            throw new SnapshotIncompatibleException(e.getMessage(), e);
        }
        for (String itemId : session.administeredItemIds) {
            if (!session.poolById.containsKey(itemId)) {
                throw new SnapshotIncompatibleException("Administered item " + itemId + " is not in the pool of session " + snapshot.sessionId());
            }
        }
        return session;
    }

    public String id() {
        return id;
    }

    public SessionState state() {
        return state;
    }

    public boolean isComplete() {
        return state == SessionState.COMPLETED;
    }

    public LearnerProfile learner() {
        return learner;
    }

    public String topic() {
        return topic;
    }

    public TerminationCriteria criteria() {
        return criteria;
    }

    public List<ItemTemplate> itemPool() {
        return itemPool;
    }

    public Optional<ItemTemplate> poolItem(String itemId) {
        return Optional.ofNullable(poolById.get(itemId));
    }

    public List<String> administeredItemIds() {
        return Collections.unmodifiableList(administeredItemIds);
    }

    public List<ItemResponse> responses() {
        return Collections.unmodifiableList(responses);
    }

    public List<AbilityEstimate> abilityHistory() {
        return Collections.unmodifiableList(abilityHistory);
    }

    public AbilityEstimate currentAbility() {
        if (abilityHistory.isEmpty()) {
            throw new InvalidSessionStateException(id, state, "read ability");
        }
        return abilityHistory.get(abilityHistory.size() - 1);
    }

    public Optional<String> activeItemId() {
        return Optional.ofNullable(activeItemId);
    }

    public int stallCount() {
        return stallCount;
    }

    public Optional<CompletionReason> completionReason() {
        return Optional.ofNullable(completionReason);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    private void complete(CompletionReason reason) {
        completionReason = reason;
        completedAt = Instant.now();
        state = SessionState.COMPLETED;
        log.info("Session {} completed after {} items: {}", id, responses.size(), reason);
    }

    private void requireState(SessionState expected, String operation) {
        if (state != expected) {
            log.warn("Rejected '{}' on session {} in state {}", operation, id, state);
            throw new InvalidSessionStateException(id, state, operation);
        }
    }

    private void checkInvariants() {
        if (responses.size() != administeredItemIds.size()) {
            throw new IllegalStateException("Session " + id + " has " + responses.size() + " responses for "
                    + administeredItemIds.size() + " administered items");
        }
        if (new HashSet<>(administeredItemIds).size() != administeredItemIds.size()) {
            throw new IllegalStateException("Session " + id + " administered an item twice");
        }
        if (abilityHistory.size() != responses.size() + 1) {
            throw new IllegalStateException("Session " + id + " has " + abilityHistory.size() + " ability estimates for "
                    + responses.size() + " responses");
        }
        for (int i = 0; i < responses.size(); i++) {
            if (!responses.get(i).itemId().equals(administeredItemIds.get(i))) {
                throw new IllegalStateException("Session " + id + " response " + i + " does not match administered item");
            }
        }
        if (activeItemId != null && (!poolById.containsKey(activeItemId) || administeredItemIds.contains(activeItemId))) {
            throw new IllegalStateException("Session " + id + " offers item " + activeItemId + " outside its remaining pool");
        }
    }

    private static Map<String, ItemTemplate> indexPool(Collection<ItemTemplate> pool) {
        Map<String, ItemTemplate> byId = new LinkedHashMap<>();
        for (ItemTemplate item : pool) {
            if (item == null || item.id() == null) {
                throw new IllegalArgumentException("Item pool contains an item without id");
            }
            if (byId.putIfAbsent(item.id(), item) != null) {
                throw new IllegalArgumentException("Item pool contains duplicate id " + item.id());
            }
        }
        return Collections.unmodifiableMap(byId);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
