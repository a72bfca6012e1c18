package com.memberhub.search.retrieval.ann;

import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.retrieval.VectorSearchProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Owns the lifecycle of the approximate vector index: a rebuild is triggered (on a fixed
 * delay when vectors changed, or on demand), runs off the request path, and swaps the new
 * snapshot in atomically. Until then, changed vectors are reported by the store as pending
 * and searched exactly.
 */
@Component
public class VectorIndexMaintenance {
    private static final Logger log = LoggerFactory.getLogger(VectorIndexMaintenance.class);

    private final ContentIndexStore store;
    private final VectorSearchProperties properties;
    private final Executor maintenanceExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicReference<AnnIndex> active = new AtomicReference<>();
    private final AtomicBoolean rebuilding = new AtomicBoolean(false);
    private final AtomicLong generations = new AtomicLong();
    private volatile Long lastBuildMs;
    private volatile String lastError;

    public VectorIndexMaintenance(
        ContentIndexStore store,
        VectorSearchProperties properties,
        @Qualifier("indexMaintenanceExecutor") Executor maintenanceExecutor,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.store = store;
        this.properties = properties;
        this.maintenanceExecutor = maintenanceExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public AnnIndex activeIndex() {
        return properties.getAnn().isEnabled() ? active.get() : null;
    }

    @Scheduled(
        fixedDelayString = "${search.vector.ann.rebuild-interval-ms:60000}",
        initialDelayString = "${search.vector.ann.rebuild-interval-ms:60000}"
    )
    public void rebuildIfStale() {
        if (!properties.getAnn().isEnabled() || store.pendingVectorCount() == 0) {
            return;
        }
        triggerRebuild();
    }

    public boolean triggerRebuild() {
        if (!properties.getAnn().isEnabled()) {
            return false;
        }
        if (!rebuilding.compareAndSet(false, true)) {
            return false;
        }
        try {
            maintenanceExecutor.execute(this::runRebuild);
            return true;
        } catch (RejectedExecutionException e) {
            rebuilding.set(false);
            log.warn("ann_rebuild_rejected message={}", e.getMessage());
            return false;
        }
    }

    public boolean rebuildNow() {
        if (!properties.getAnn().isEnabled()) {
            return false;
        }
        if (!rebuilding.compareAndSet(false, true)) {
            return false;
        }
        runRebuild();
        return true;
    }

    public AnnIndexStatus status() {
        AnnIndex index = active.get();
        return new AnnIndexStatus(
            properties.getAnn().isEnabled(),
            rebuilding.get(),
            index == null ? 0L : index.getGeneration(),
            index == null ? 0 : index.size(),
            store.pendingVectorCount(),
            index == null ? null : index.getBuiltAt(),
            lastBuildMs,
            lastError
        );
    }

    private void runRebuild() {
        long started = System.nanoTime();
        try {
            long generation = generations.incrementAndGet();
            AnnIndex rebuilt = AnnIndex.build(
                generation,
                clock.instant(),
                new ArrayList<>(store.all()),
                store.dimension(),
                properties.getAnn()
            );
            active.set(rebuilt);
            store.acknowledgeIndexed(rebuilt.getRevisions());
            lastBuildMs = (System.nanoTime() - started) / 1_000_000L;
            lastError = null;
            meterRegistry.counter("search.ann.rebuilds", "outcome", "success").increment();
            log.info(
                "ann_index_rebuilt generation={} size={} pending={} took_ms={}",
                generation,
                rebuilt.size(),
                store.pendingVectorCount(),
                lastBuildMs
            );
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            meterRegistry.counter("search.ann.rebuilds", "outcome", "failure").increment();
            log.warn("ann_index_rebuild_failed message={}", e.getMessage(), e);
        } finally {
            rebuilding.set(false);
        }
    }
}
