package com.memberhub.search.service;

import static com.memberhub.search.support.IndexFixtures.key;
import static com.memberhub.search.support.IndexFixtures.lexical;
import static com.memberhub.search.support.IndexFixtures.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.memberhub.search.index.ContentIndexRepository.StoredRow;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.IndexProperties;
import com.memberhub.search.support.IndexFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContentIndexServiceTest {
    private static final Instant UPDATED_AT = Instant.parse("2024-04-30T08:00:00Z");

    @Test
    void startupRestoresRowsAndBuildsGraph() {
        IndexFixtures fixtures = new IndexFixtures(2);
        when(fixtures.repository.findAll()).thenReturn(List.of(
            new StoredRow(key(ContentType.EVENT, "e1"), vector(1f, 0f), "gala", null, Map.of(), UPDATED_AT),
            new StoredRow(key(ContentType.FAQ, "f1"), null, null, lexical("Refunds", null, null), Map.of(), UPDATED_AT),
            new StoredRow(key(ContentType.FAQ, "bad"), vector(1f, 0f, 0f), null, null, Map.of(), UPDATED_AT)
        ));
        ContentIndexService service = service(fixtures, properties(2, true));

        service.loadOnStartup();

        IndexStatus status = service.status();
        assertThat(status.dimension()).isEqualTo(2);
        assertThat(status.items()).isEqualTo(2);
        assertThat(status.itemsByType()).containsEntry(ContentType.EVENT, 1).containsEntry(ContentType.FAQ, 1);
        assertThat(status.vectors()).isEqualTo(1);
        assertThat(status.lexicalDocuments()).isEqualTo(1);
        assertThat(status.ann().generation()).isEqualTo(1L);
        assertThat(status.ann().size()).isEqualTo(1);
        assertThat(status.ann().pendingVectors()).isZero();
    }

    @Test
    void startupLoadCanBeDisabled() {
        IndexFixtures fixtures = new IndexFixtures(2);
        ContentIndexService service = service(fixtures, properties(2, false));

        service.loadOnStartup();

        verifyNoInteractions(fixtures.repository);
        assertThat(service.status().items()).isZero();
        assertThat(service.status().ann().generation()).isZero();
    }

    private static ContentIndexService service(IndexFixtures fixtures, IndexProperties properties) {
        return new ContentIndexService(
            fixtures.store,
            fixtures.repository,
            fixtures.lexicalIndex,
            fixtures.maintenance,
            properties
        );
    }

    private static IndexProperties properties(int dimension, boolean loadOnStartup) {
        IndexProperties properties = new IndexProperties();
        properties.setDimension(dimension);
        properties.setLoadOnStartup(loadOnStartup);
        return properties;
    }
}
