package com.herzen.cat.api;

import com.herzen.cat.analytics.AnalyticsModels;
import com.herzen.cat.analytics.AnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {
    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/exposure")
    public ResponseEntity<AnalyticsModels.ItemExposureResponse> exposure(@RequestParam(required = false) String topic) {
        return ResponseEntity.ok(analyticsService.itemExposure(topic));
    }

    @GetMapping("/sessions/{sessionId}/events")
    public ResponseEntity<AnalyticsModels.SessionTimelineResponse> timeline(@PathVariable String sessionId) {
        return ResponseEntity.ok(analyticsService.timeline(sessionId));
    }
}
