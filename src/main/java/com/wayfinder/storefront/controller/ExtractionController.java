package com.wayfinder.storefront.controller;

import com.wayfinder.storefront.model.api.AgentStatusResponse;
import com.wayfinder.storefront.model.api.ItineraryResponse;
import com.wayfinder.storefront.model.api.TripContextResponse;
import com.wayfinder.storefront.model.api.TripEntitiesResponse;
import com.wayfinder.storefront.service.AgentBuilderClient;
import com.wayfinder.storefront.service.TripExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class ExtractionController {

    private static final Logger log = LoggerFactory.getLogger(ExtractionController.class);

    private final TripExtractionService tripExtractionService;
    private final AgentBuilderClient agentBuilderClient;

    public ExtractionController(TripExtractionService tripExtractionService, AgentBuilderClient agentBuilderClient) {
        this.tripExtractionService = tripExtractionService;
        this.agentBuilderClient = agentBuilderClient;
    }

    @PostMapping("/parse-trip-context")
    public Mono<TripContextResponse> parseTripContext(@RequestParam String message) {
        return tripExtractionService.parseTripContext(message);
    }

    @PostMapping("/extract-itinerary")
    public Mono<ItineraryResponse> extractItinerary(@RequestParam("trip_plan") String tripPlan) {
        return tripExtractionService.extractItinerary(tripPlan);
    }

    @PostMapping("/extract-trip-entities")
    public Mono<TripEntitiesResponse> extractTripEntities(@RequestParam("trip_plan") String tripPlan) {
        return tripExtractionService.extractTripEntities(tripPlan);
    }

    /**
     * Never fails: a transport error is reported in the body with {@code exists=false}.
     */
    @GetMapping("/agent-status/{agentId}")
    public Mono<AgentStatusResponse> agentStatus(@PathVariable String agentId) {
        return agentBuilderClient.agentExists(agentId)
                .map(exists -> AgentStatusResponse.found(agentId, exists))
                .onErrorResume(ex -> {
                    log.warn("Agent status check failed agentId={}: {}", agentId, ex.toString());
                    return Mono.just(AgentStatusResponse.failed(agentId, ex.getMessage() == null ? ex.toString() : ex.getMessage()));
                });
    }
}
