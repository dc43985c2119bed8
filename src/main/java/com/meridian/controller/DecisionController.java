package com.meridian.controller;

import com.meridian.counter.MonotonicClock;
import com.meridian.model.DecisionFilter;
import com.meridian.model.RoutingDecision;
import com.meridian.model.TaskCategory;
import com.meridian.model.dto.DecisionExplanation;
import com.meridian.model.dto.DecisionSummary;
import com.meridian.service.DecisionLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decision history, summaries and explanations.
 */
@Slf4j
@RestController
@RequestMapping("/v1/decisions")
public class DecisionController {

    private static final Duration DEFAULT_SUMMARY_PERIOD = Duration.ofDays(7);

    private final DecisionLogService decisionLog;
    private final MonotonicClock clock;

    public DecisionController(DecisionLogService decisionLog, MonotonicClock clock) {
        this.decisionLog = decisionLog;
        this.clock = clock;
    }

    /**
     * Decision history, newest first.
     *
     * @param from         Only decisions at or after this timestamp (optional)
     * @param to           Only decisions before this timestamp (optional)
     * @param taskCategory Filter by task category id (optional)
     * @param provider     Filter by selected provider (optional)
     * @param limit        Maximum number of decisions (default 100)
     */
    @GetMapping("/{orgId}")
    public ResponseEntity<List<RoutingDecision>> getHistory(
            @PathVariable String orgId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String taskCategory,
            @RequestParam(required = false) String provider,
            @RequestParam(defaultValue = "100") int limit) {

        log.debug("Decision history org={} from={} to={} category={} provider={} limit={}",
                orgId, from, to, taskCategory, provider, limit);

        DecisionFilter filter = DecisionFilter.builder()
                .from(from)
                .to(to)
                .taskCategory(taskCategory != null ? TaskCategory.fromId(taskCategory) : null)
                .provider(provider)
                .limit(limit)
                .build();
        return ResponseEntity.ok(decisionLog.getHistory(orgId, filter));
    }

    /**
     * Aggregates over [from, to), defaulting to the last seven days.
     */
    @GetMapping("/{orgId}/summary")
    public ResponseEntity<DecisionSummary> getSummary(
            @PathVariable String orgId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_SUMMARY_PERIOD);
        return ResponseEntity.ok(decisionLog.summary(orgId, start, end));
    }

    @GetMapping("/explain/{decisionId}")
    public ResponseEntity<DecisionExplanation> explain(@PathVariable String decisionId) {
        return ResponseEntity.ok(decisionLog.explain(decisionId));
    }
}
