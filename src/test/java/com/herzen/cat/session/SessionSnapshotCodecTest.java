package com.herzen.cat.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.cat.CatFixtures;
import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.exception.SnapshotIncompatibleException;
import com.herzen.cat.exception.UnknownOrDuplicateItemException;
import com.herzen.cat.session.SessionModels.SessionSnapshot;
import com.herzen.cat.session.SessionModels.SessionState;
import com.herzen.cat.termination.TerminationCriteria;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionSnapshotCodecTest {
    private CatEngine engine;
    private SessionSnapshotCodec codec;
    private List<ItemTemplate> pool;

    @BeforeEach
    void setUp() {
        engine = CatFixtures.engine();
        codec = new SessionSnapshotCodec(new ObjectMapper().findAndRegisterModules());
        pool = CatFixtures.pool();
    }

    private AdaptiveSession sessionAfter(int answers) {
        AdaptiveSession session = engine.newSession();
        session.start(CatFixtures.learner(), "math", pool, null);
        for (int i = 0; i < answers; i++) {
            String itemId = session.advanceToNextItem().orElseThrow().id();
            session.recordResponse(itemId, i % 2 == 0, i % 2 == 0 ? 1.0 : 0.0, Duration.ofMillis(1500 + i), "choice " + i);
        }
        return session;
    }

    @Test
    void midSessionSurvivesJsonAndResumes() {
        AdaptiveSession original = sessionAfter(4);

        SessionSnapshot snapshot = original.snapshot();
        SessionSnapshot decoded = codec.read(codec.write(snapshot));
        assertEquals(snapshot, decoded);

        AdaptiveSession restored = engine.restore(decoded, pool);
        assertEquals(original.id(), restored.id());
        assertEquals(SessionState.IN_PROGRESS, restored.state());
        assertEquals(original.administeredItemIds(), restored.administeredItemIds());
        assertEquals(original.responses(), restored.responses());
        assertEquals(original.abilityHistory(), restored.abilityHistory());
        assertEquals(original.stallCount(), restored.stallCount());
        assertEquals(original.advanceToNextItem().orElseThrow().id(),
                restored.advanceToNextItem().orElseThrow().id());
    }

    @Test
    void completedSessionKeepsReason() {
        AdaptiveSession session = engine.newSession();
        session.start(CatFixtures.learner(), pool, new TerminationCriteria(0.3, 2, null, 3));
        session.recordResponse(session.advanceToNextItem().orElseThrow().id(), true, 1.0, Duration.ZERO, "");
        session.recordResponse(session.advanceToNextItem().orElseThrow().id(), false, 0.0, Duration.ZERO, "");

        AdaptiveSession restored = engine.restore(codec.read(codec.write(session.snapshot())), pool);

        assertTrue(restored.isComplete());
        assertEquals(session.completionReason(), restored.completionReason());
        assertEquals(session.completedAt(), restored.completedAt());
    }

    @Test
    void offeredItemSurvivesRestore() {
        AdaptiveSession original = sessionAfter(2);
        String offered = original.advanceToNextItem().orElseThrow().id();

        AdaptiveSession restored = engine.restore(codec.read(codec.write(original.snapshot())), pool);

        assertEquals(Optional.of(offered), restored.activeItemId());
        String other = pool.stream().map(ItemTemplate::id)
                .filter(id -> !id.equals(offered) && !restored.administeredItemIds().contains(id))
                .findFirst().orElseThrow();
        assertThrows(UnknownOrDuplicateItemException.class,
                () -> restored.recordResponse(other, true, 1.0, Duration.ZERO, ""));
        restored.recordResponse(offered, true, 1.0, Duration.ZERO, "");
        assertEquals(3, restored.responses().size());
    }

    @Test
    void offeredItemOutsidePoolIsIncompatible() {
        SessionSnapshot s = sessionAfter(1).snapshot();
        SessionSnapshot broken = new SessionSnapshot(s.schemaVersion(), s.sessionId(), s.learner(), s.topic(), s.state(),
                s.completionReason(), s.criteria(), s.poolItemIds(), s.administeredItemIds(), s.responses(),
                s.abilityHistory(), s.administeredItemIds().get(0), s.stallCount(), s.startedAt(), s.completedAt());

        assertThrows(SnapshotIncompatibleException.class, () -> engine.restore(broken, pool));
    }

    @Test
    void garbageIsIncompatible() {
        assertThrows(SnapshotIncompatibleException.class, () -> codec.read("{\"schemaVersion\": \"x\""));
    }

    @Test
    void unknownSchemaVersionIsIncompatible() {
        SessionSnapshot s = sessionAfter(1).snapshot();
        SessionSnapshot future = new SessionSnapshot(99, s.sessionId(), s.learner(), s.topic(), s.state(),
                s.completionReason(), s.criteria(), s.poolItemIds(), s.administeredItemIds(), s.responses(),
                s.abilityHistory(), s.activeItemId(), s.stallCount(), s.startedAt(), s.completedAt());

        assertThrows(SnapshotIncompatibleException.class, () -> engine.restore(future, pool));
    }

    @Test
    void missingPoolItemIsIncompatible() {
        SessionSnapshot snapshot = sessionAfter(2).snapshot();
        List<ItemTemplate> shrunk = pool.stream()
                .filter(item -> !item.id().equals(snapshot.administeredItemIds().get(0)))
                .toList();

        assertThrows(SnapshotIncompatibleException.class, () -> engine.restore(snapshot, shrunk));
    }

    @Test
    void inconsistentHistoryIsIncompatible() {
        SessionSnapshot s = sessionAfter(2).snapshot();
        SessionSnapshot broken = new SessionSnapshot(s.schemaVersion(), s.sessionId(), s.learner(), s.topic(), s.state(),
                s.completionReason(), s.criteria(), s.poolItemIds(), s.administeredItemIds(), s.responses(),
                s.abilityHistory().subList(0, 2), s.activeItemId(), s.stallCount(), s.startedAt(), s.completedAt());

        assertThrows(SnapshotIncompatibleException.class, () -> engine.restore(broken, pool));
    }
}
