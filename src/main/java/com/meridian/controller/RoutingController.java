package com.meridian.controller;

import com.meridian.model.OutcomeReport;
import com.meridian.model.RoutingDecision;
import com.meridian.model.RoutingRequest;
import com.meridian.service.RoutingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routing API: admission plus model selection, and outcome reporting after the provider call.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class RoutingController {

    private final RoutingService routingService;

    public RoutingController(RoutingService routingService) {
        this.routingService = routingService;
    }

    /**
     * Admit a request and pick the model to call. Denials surface as 429 problem responses.
     */
    @PostMapping(value = "/route", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RoutingDecision> route(@RequestBody RoutingRequest request) {
        log.info("Route request org={} category={} tokensIn={} tokensOut={}",
                request.getOrganizationId(), request.getTaskCategory(),
                request.getEstimatedTokensIn(), request.getEstimatedTokensOut());

        return ResponseEntity.ok(routingService.routeRequest(request));
    }

    /**
     * Report the result of a routed call so the reservation is reconciled.
     */
    @PostMapping(value = "/outcomes", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> reportOutcome(@RequestBody OutcomeReport report) {
        log.debug("Outcome for reservation={} success={}", report.getReservationId(), report.isSuccess());

        routingService.reportOutcome(report);
        return ResponseEntity.accepted().build();
    }
}
