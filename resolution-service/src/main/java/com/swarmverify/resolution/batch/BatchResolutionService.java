package com.swarmverify.resolution.batch;

import com.swarmverify.common.exception.MarketNotFoundException;
import com.swarmverify.common.model.BatchResolutionItem;
import com.swarmverify.common.model.Market;
import com.swarmverify.common.model.Resolution;
import com.swarmverify.resolution.ledger.MarketLedger;
import com.swarmverify.resolution.review.SecondPassReviewer;
import com.swarmverify.resolution.service.SwarmOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Resolves markets one after another, isolating each: a failing market becomes a
 * {@code failed} item and the batch continues. Only a missing reasoning backend aborts
 * the whole batch, before any market is touched.
 */
@Service
public class BatchResolutionService {

    private static final Logger log = LoggerFactory.getLogger(BatchResolutionService.class);

    private final SwarmOrchestrator orchestrator;
    private final SecondPassReviewer reviewer;
    private final MarketLedger ledger;
    private final Clock clock;

    public BatchResolutionService(SwarmOrchestrator orchestrator, SecondPassReviewer reviewer,
                                  MarketLedger ledger, Clock clock) {
        this.orchestrator = orchestrator;
        this.reviewer     = reviewer;
        this.ledger       = ledger;
        this.clock        = clock;
    }

    public Mono<List<BatchResolutionItem>> resolveBatch(List<String> marketIds) {
        return Mono.defer(() -> {
            orchestrator.ensureBackendAvailable();
            log.info("[Batch] Resolving {} markets sequentially", marketIds.size());
            return Flux.fromIterable(marketIds)
                .concatMap(this::resolveOne)
                .collectList()
                .doOnNext(items -> log.info("[Batch] Complete. total={} failed={}", items.size(),
                    items.stream().filter(i -> i.status() == BatchResolutionItem.Status.FAILED).count()));
        });
    }

    /** Resolves every market whose resolution date has arrived and that has no recorded resolution. */
    public Mono<List<BatchResolutionItem>> resolveDue() {
        return Mono.defer(() -> {
            LocalDate today = LocalDate.now(clock);
            List<String> due = ledger.unresolvedDueMarkets(today).stream().map(Market::id).toList();
            log.info("[Batch] Sweep found {} due markets. asOf={}", due.size(), today);
            return resolveBatch(due);
        });
    }

    private Mono<BatchResolutionItem> resolveOne(String marketId) {
        return Mono.fromCallable(() -> ledger.findMarket(marketId)
                .orElseThrow(() -> new MarketNotFoundException(marketId)))
            .flatMap(market -> orchestrator.resolve(market)
                .doOnNext(resolution -> ledger.recordResolution(marketId, resolution))
                .flatMap(resolution -> withSecondPass(market, resolution)))
            .onErrorResume(e -> {
                log.error("[Batch] Market failed. marketId={} reason={}", marketId, e.getMessage());
                return Mono.just(BatchResolutionItem.failed(marketId,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            });
    }

    private Mono<BatchResolutionItem> withSecondPass(Market market, Resolution resolution) {
        if (!resolution.requiresSecondPass()) {
            return Mono.just(BatchResolutionItem.success(market.id(), resolution, null));
        }
        return reviewer.review(market, resolution)
            .doOnNext(review -> ledger.recordSecondPass(market.id(), review))
            .map(review -> BatchResolutionItem.success(market.id(), resolution, review));
    }
}
