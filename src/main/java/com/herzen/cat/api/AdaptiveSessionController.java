package com.herzen.cat.api;

import com.herzen.cat.bank.ItemBankModels;
import com.herzen.cat.report.SessionReport;
import com.herzen.cat.service.AdaptiveTestService;
import com.herzen.cat.session.SessionModels;
import com.herzen.cat.termination.TerminationCriteria;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class AdaptiveSessionController {
    private final AdaptiveTestService testService;

    public AdaptiveSessionController(AdaptiveTestService testService) {
        this.testService = testService;
    }

    @PostMapping("/start")
    public ResponseEntity<AdaptiveTestService.SessionView> start(@RequestBody StartRequest request) {
        SessionModels.LearnerProfile learner = new SessionModels.LearnerProfile(
                request.learnerId(), request.learnerName(), request.objectives());
        return ResponseEntity.ok(testService.startSession(learner, request.topic(), request.criteria()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<AdaptiveTestService.SessionView> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(testService.session(sessionId));
    }

    // 204: pool exhausted, session completed
    @PostMapping("/{sessionId}/next")
    public ResponseEntity<ItemBankModels.ItemTemplate> next(@PathVariable String sessionId) {
        return testService.nextItem(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{sessionId}/responses")
    public ResponseEntity<SessionModels.ItemResponse> respond(@PathVariable String sessionId,
                                                              @RequestBody AdaptiveTestService.ResponseSubmission request) {
        return ResponseEntity.ok(testService.submitResponse(sessionId, request));
    }

    @GetMapping("/{sessionId}/report")
    public ResponseEntity<SessionReport> report(@PathVariable String sessionId) {
        return ResponseEntity.ok(testService.report(sessionId));
    }

    @GetMapping("/reports")
    public ResponseEntity<List<SessionReport>> reports(@RequestParam String learnerId,
                                                       @RequestParam(required = false) SessionModels.SessionState state) {
        return ResponseEntity.ok(testService.reportsForLearner(learnerId, state));
    }

    public record StartRequest(String learnerId,
                               String learnerName,
                               List<String> objectives,
                               String topic,
                               TerminationCriteria criteria) {}
}
