package com.swarmverify.resolution.controller;

import com.swarmverify.common.exception.MarketNotFoundException;
import com.swarmverify.common.exception.ReasoningBackendUnavailableException;
import com.swarmverify.common.model.BatchResolutionItem;
import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.common.model.SecondPassReview;
import com.swarmverify.resolution.batch.BatchResolutionService;
import com.swarmverify.resolution.guard.RateLimitExceededException;
import com.swarmverify.resolution.guard.ResolutionRateLimiter;
import com.swarmverify.resolution.ledger.MarketLedger;
import com.swarmverify.resolution.review.SecondPassReviewer;
import com.swarmverify.resolution.service.SwarmOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/resolution")
public class ResolutionController {

    private static final Logger log = LoggerFactory.getLogger(ResolutionController.class);

    static final String CLIENT_HEADER    = "X-Client-Id";
    static final String ANONYMOUS_CLIENT = "anonymous";
    static final String SWEEP_SECRET_HEADER = "X-Sweep-Secret";

    private final SwarmOrchestrator orchestrator;
    private final BatchResolutionService batchService;
    private final SecondPassReviewer reviewer;
    private final MarketLedger ledger;
    private final ResolutionRateLimiter rateLimiter;
    private final byte[] sweepSecret;

    public ResolutionController(SwarmOrchestrator orchestrator,
                                BatchResolutionService batchService,
                                SecondPassReviewer reviewer,
                                MarketLedger ledger,
                                ResolutionRateLimiter rateLimiter,
                                @Value("${swarm.sweep.secret:}") String sweepSecret) {
        this.orchestrator = orchestrator;
        this.batchService = batchService;
        this.reviewer     = reviewer;
        this.ledger       = ledger;
        this.rateLimiter  = rateLimiter;
        this.sweepSecret  = sweepSecret == null ? new byte[0] : sweepSecret.getBytes(StandardCharsets.UTF_8);
        if (this.sweepSecret.length == 0) {
            log.warn("[API] swarm.sweep.secret is not set; POST /sweep will reject every caller");
        }
    }

    @PostMapping("/markets")
    public ResponseEntity<Market> registerMarket(@RequestBody Market market) {
        if (market.id() == null || market.id().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        ledger.saveMarket(market);
        log.info("[API] Market registered. marketId={} resolutionDate={}", market.id(), market.resolutionDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(market);
    }

    @PostMapping("/{marketId}")
    public Mono<Resolution> resolve(@PathVariable String marketId,
                                    @RequestHeader(value = CLIENT_HEADER, defaultValue = ANONYMOUS_CLIENT) String clientId) {
        rateLimiter.acquire(clientId, ResolutionRateLimiter.RESOLVE_COST);
        Market market = ledger.findMarket(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
        return orchestrator.resolve(market)
            .doOnNext(resolution -> ledger.recordResolution(marketId, resolution));
    }

    @PostMapping("/batch")
    public Mono<List<BatchResolutionItem>> resolveBatch(@RequestBody BatchResolutionRequest request,
                                                        @RequestHeader(value = CLIENT_HEADER, defaultValue = ANONYMOUS_CLIENT) String clientId) {
        rateLimiter.acquire(clientId, rateLimiter.batchCost(request.marketIds().size()));
        return batchService.resolveBatch(request.marketIds());
    }

    /** Scheduler entry point. Callers must present the shared secret configured as {@code swarm.sweep.secret}. */
    @PostMapping("/sweep")
    public Mono<ResponseEntity<List<BatchResolutionItem>>> sweep(
            @RequestHeader(value = SWEEP_SECRET_HEADER, required = false) String secret) {
        if (!sweepAuthorized(secret)) {
            log.warn("[API] Sweep rejected: missing or wrong {}", SWEEP_SECRET_HEADER);
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
        }
        return batchService.resolveDue().map(ResponseEntity::ok);
    }

    @PostMapping("/{marketId}/second-pass")
    public Mono<SecondPassReview> secondPass(@PathVariable String marketId,
                                             @RequestHeader(value = CLIENT_HEADER, defaultValue = ANONYMOUS_CLIENT) String clientId) {
        rateLimiter.acquire(clientId, ResolutionRateLimiter.RESOLVE_COST);
        Market market = ledger.findMarket(marketId).orElseThrow(() -> new MarketNotFoundException(marketId));
        Resolution firstPass = ledger.latestResolution(marketId)
            .orElseThrow(() -> new MarketNotFoundException(marketId, "No resolution recorded for market " + marketId));
        return reviewer.review(market, firstPass)
            .doOnNext(review -> ledger.recordSecondPass(marketId, review));
    }

    private boolean sweepAuthorized(String presented) {
        if (sweepSecret.length == 0 || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(sweepSecret, presented.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of("status", "UP", "service", "resolution-service"));
    }

    @ExceptionHandler(ReasoningBackendUnavailableException.class)
    public ResponseEntity<Map<String, String>> onBackendUnavailable(ReasoningBackendUnavailableException e) {
        log.error("[API] Reasoning backend unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MarketNotFoundException.class)
    public ResponseEntity<Map<String, String>> onMarketNotFound(MarketNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", e.getMessage(), "marketId", e.getMarketId()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, String>> onRateLimited(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
            .body(Map.of("error", e.getMessage()));
    }
}
