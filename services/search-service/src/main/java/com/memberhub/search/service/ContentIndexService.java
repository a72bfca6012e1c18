package com.memberhub.search.service;

import com.memberhub.search.index.ContentIndexRepository;
import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.IndexProperties;
import com.memberhub.search.index.UpsertCommand;
import com.memberhub.search.index.UpsertResult;
import com.memberhub.search.retrieval.ann.VectorIndexMaintenance;
import com.memberhub.search.retrieval.lexical.LexicalIndex;
import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ContentIndexService {
    private static final Logger log = LoggerFactory.getLogger(ContentIndexService.class);

    private final ContentIndexStore store;
    private final ContentIndexRepository repository;
    private final LexicalIndex lexicalIndex;
    private final VectorIndexMaintenance maintenance;
    private final IndexProperties properties;

    public ContentIndexService(
        ContentIndexStore store,
        ContentIndexRepository repository,
        LexicalIndex lexicalIndex,
        VectorIndexMaintenance maintenance,
        IndexProperties properties
    ) {
        this.store = store;
        this.repository = repository;
        this.lexicalIndex = lexicalIndex;
        this.maintenance = maintenance;
        this.properties = properties;
    }

    @PostConstruct
    public void loadOnStartup() {
        if (!properties.isLoadOnStartup()) {
            log.info("content_index_load_skipped");
            return;
        }
        long started = System.nanoTime();
        List<ContentIndexRepository.StoredRow> rows = repository.findAll();
        int restored = store.restore(rows);
        maintenance.rebuildNow();
        log.info(
            "content_index_loaded rows={} restored={} vectors={} took_ms={}",
            rows.size(),
            restored,
            store.vectorCount(),
            (System.nanoTime() - started) / 1_000_000L
        );
    }

    public UpsertResult upsert(UpsertCommand command) {
        return store.upsert(command);
    }

    public boolean remove(ContentKey key) {
        return store.remove(key);
    }

    public boolean rebuild() {
        return maintenance.triggerRebuild();
    }

    public IndexStatus status() {
        return new IndexStatus(
            store.dimension(),
            store.size(),
            store.countsByType(),
            store.vectorCount(),
            lexicalIndex.documentCount(),
            maintenance.status()
        );
    }
}
