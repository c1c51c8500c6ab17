package com.dbexplorer.controller;

import com.dbexplorer.api.ChatMessageEnvelope;
import com.dbexplorer.api.ChatReply;
import com.dbexplorer.api.ErrorResponse;
import com.dbexplorer.api.HealthResponse;
import com.dbexplorer.bot.InteractionDispatcher;
import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.domain.DomainStatus;
import com.dbexplorer.service.HealthService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class ExplorerController {

    private static final Logger log = LoggerFactory.getLogger(ExplorerController.class);

    private final InteractionDispatcher dispatcher;
    private final HealthService healthService;
    private final DomainResolver domainResolver;

    public ExplorerController(InteractionDispatcher dispatcher,
                              HealthService healthService,
                              DomainResolver domainResolver) {
        this.dispatcher = dispatcher;
        this.healthService = healthService;
        this.domainResolver = domainResolver;
    }

    /**
     * Run one chat interaction and return its reply.
     *
     * POST /v1/interactions
     *
     * @param envelope command or callback from the chat transport
     * @return reply to render
     */
    @PostMapping("/interactions")
    public ResponseEntity<ChatReply> interact(@Valid @RequestBody ChatMessageEnvelope envelope) {
        log.debug("Interaction received: user_id={}, command={}, trace_id={}",
                envelope.getUserId(), envelope.getCommand(), MDC.get("trace_id"));
        return ResponseEntity.ok(dispatcher.dispatchAndWait(envelope));
    }

    /**
     * Cancel a running interaction.
     *
     * POST /v1/interactions/{id}/cancel
     */
    @PostMapping("/interactions/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") String interactionId) {
        if (!dispatcher.cancel(interactionId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                    .code("NOT_RUNNING")
                    .message("No running interaction with id " + interactionId)
                    .traceId(MDC.get("trace_id"))
                    .build());
        }
        log.info("Cancel requested: interaction_id={}, trace_id={}", interactionId, MDC.get("trace_id"));
        return ResponseEntity.ok(Map.of("cancelled", true));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.check());
    }

    @GetMapping("/domains")
    public ResponseEntity<List<DomainStatus>> domains() {
        return ResponseEntity.ok(domainResolver.statuses());
    }

    @PostMapping("/domains/refresh")
    public ResponseEntity<List<DomainStatus>> refreshDomains() {
        log.info("Domain refresh requested: trace_id={}", MDC.get("trace_id"));
        return ResponseEntity.ok(domainResolver.refresh());
    }
}
