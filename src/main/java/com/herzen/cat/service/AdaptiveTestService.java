package com.herzen.cat.service;

import com.herzen.cat.analytics.AnalyticsService;
import com.herzen.cat.analytics.LearningEventTypes;
import com.herzen.cat.bank.ItemBankModels.ItemTemplate;
import com.herzen.cat.bank.ItemBankService;
import com.herzen.cat.exception.SessionNotFoundException;
import com.herzen.cat.irt.IrtModels.AbilityEstimate;
import com.herzen.cat.report.SessionReport;
import com.herzen.cat.report.SessionReportBuilder;
import com.herzen.cat.repository.SessionJdbcRepository;
import com.herzen.cat.session.AdaptiveSession;
import com.herzen.cat.session.CatEngine;
import com.herzen.cat.session.SessionModels.*;
import com.herzen.cat.termination.CompletionReason;
import com.herzen.cat.termination.TerminationCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

@Service
public class AdaptiveTestService {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveTestService.class);
    private static final int LOCK_STRIPES = 64;

    private final CatEngine engine;
    private final ItemBankService itemBank;
    private final SessionJdbcRepository repository;
    private final SessionReportBuilder reportBuilder;
    private final AnalyticsService analytics;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public AdaptiveTestService(CatEngine engine,
                               ItemBankService itemBank,
                               SessionJdbcRepository repository,
                               SessionReportBuilder reportBuilder,
                               AnalyticsService analytics) {
        this.engine = engine;
        this.itemBank = itemBank;
        this.repository = repository;
        this.reportBuilder = reportBuilder;
        this.analytics = analytics;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public SessionView startSession(LearnerProfile learner, String topic, TerminationCriteria criteria) {
        String normalizedTopic = topic == null || topic.isBlank() ? null : topic.trim();
        List<ItemTemplate> pool = itemBank.pool(normalizedTopic);

        AdaptiveSession session = engine.newSession();
        session.start(learner, normalizedTopic, pool, criteria);
        repository.save(session.snapshot());
        analytics.record(session.id(), learner.id(), normalizedTopic, null, LearningEventTypes.SESSION_START,
                "items=" + pool.size());
        return SessionView.of(session);
    }

    public Optional<ItemTemplate> nextItem(String sessionId) {
        return withSession(sessionId, session -> {
            Optional<ItemTemplate> next = session.advanceToNextItem();
            repository.save(session.snapshot());
            if (next.isPresent()) {
                analytics.record(session.id(), session.learner().id(), session.topic(), next.get().id(),
                        LearningEventTypes.ITEM_PRESENTED, null);
            } else {
                recordCompletion(session);
            }
            return next;
        });
    }

    public ItemResponse submitResponse(String sessionId, ResponseSubmission submission) {
        return withSession(sessionId, session -> {
            double score = submission.score() != null ? submission.score() : (submission.correct() ? 1.0 : 0.0);
            Duration responseTime = submission.responseTimeMs() == null ? Duration.ZERO : Duration.ofMillis(submission.responseTimeMs());

            ItemResponse response = session.recordResponse(submission.itemId(), submission.correct(), score,
                    responseTime, submission.rawResponse());
            repository.save(session.snapshot());

            AbilityEstimate ability = response.abilityAfter();
            analytics.record(session.id(), session.learner().id(), session.topic(), response.itemId(),
                    LearningEventTypes.RESPONSE_RECORDED,
                    String.format(Locale.US, "correct=%s,score=%.2f,theta=%.4f,se=%.4f,method=%s",
                            response.correct(), response.score(), ability.theta(), ability.standardError(), ability.method()));
            if (session.isComplete()) {
                recordCompletion(session);
            }
            return response;
        });
    }

    public SessionView session(String sessionId) {
        return withSession(sessionId, SessionView::of);
    }

    public SessionReport report(String sessionId) {
        return withSession(sessionId, reportBuilder::build);
    }

    public List<SessionReport> reportsForLearner(String learnerId, SessionState state) {
        return repository.findByLearner(learnerId, state).stream()
                .map(this::restore)
                .map(reportBuilder::build)
                .toList();
    }

    private <T> T withSession(String sessionId, Function<AdaptiveSession, T> action) {
        ReentrantLock lock = locks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            AdaptiveSession session = repository.findById(sessionId)
                    .map(this::restore)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            return action.apply(session);
        } finally {
            lock.unlock();
        }
    }

    private AdaptiveSession restore(SessionSnapshot snapshot) {
        return engine.restore(snapshot, itemBank.pool(snapshot.topic()));
    }

    private void recordCompletion(AdaptiveSession session) {
        AbilityEstimate ability = session.currentAbility();
        String reason = session.completionReason().map(CompletionReason::name).orElse("UNKNOWN");
        log.info("Session {} for learner {} finished: reason={}, theta={}, se={}, items={}",
                session.id(), session.learner().id(), reason, ability.theta(), ability.standardError(), session.responses().size());
        analytics.record(session.id(), session.learner().id(), session.topic(), null, LearningEventTypes.SESSION_COMPLETE,
                "reason=" + reason + ",items=" + session.responses().size());
    }

    public record ResponseSubmission(String itemId, boolean correct, Double score, Long responseTimeMs, String rawResponse) {}

    public record SessionView(String sessionId,
                              String learnerId,
                              String topic,
                              SessionState state,
                              CompletionReason completionReason,
                              int itemsAdministered,
                              int poolSize,
                              int stallCount,
                              AbilityEstimate currentAbility,
                              TerminationCriteria criteria) {
        public static SessionView of(AdaptiveSession session) {
            return new SessionView(session.id(), session.learner().id(), session.topic(), session.state(),
                    session.completionReason().orElse(null), session.administeredItemIds().size(),
                    session.itemPool().size(), session.stallCount(), session.currentAbility(), session.criteria());
        }
    }
}
