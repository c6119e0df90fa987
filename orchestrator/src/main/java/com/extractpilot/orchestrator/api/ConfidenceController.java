package com.extractpilot.orchestrator.api;

import com.extractpilot.orchestrator.api.dto.AggregateConfidenceRequest;
import com.extractpilot.orchestrator.confidence.ConfidenceAggregator;
import com.extractpilot.orchestrator.confidence.ConfidenceBreakdown;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * POST /confidence: aggregate arbitrary source scores without running anything.
 */
@RestController
@RequestMapping("/confidence")
public class ConfidenceController {

    private final ConfidenceAggregator aggregator;

    public ConfidenceController(ConfidenceAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @PostMapping
    public ConfidenceBreakdown aggregate(@RequestBody AggregateConfidenceRequest req) {
        try {
            return aggregator.breakdown(req.sources(), req.weights(), req.reviewThreshold());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
