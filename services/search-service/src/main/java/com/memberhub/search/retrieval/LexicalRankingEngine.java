package com.memberhub.search.retrieval;

import com.memberhub.search.filter.MetadataFilter;
import com.memberhub.search.index.ContentIndexStore;
import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.IndexedContent;
import com.memberhub.search.retrieval.lexical.LexicalIndex;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class LexicalRankingEngine {
    static final Comparator<LexicalHit> ORDER = Comparator
        .comparingDouble(LexicalHit::rank).reversed()
        .thenComparing(LexicalHit::key);

    private final ContentIndexStore store;
    private final LexicalIndex lexicalIndex;

    public LexicalRankingEngine(ContentIndexStore store, LexicalIndex lexicalIndex) {
        this.store = store;
        this.lexicalIndex = lexicalIndex;
    }

    public List<LexicalHit> search(String queryText, Set<ContentType> types, List<MetadataFilter> filters, int limit) {
        if (limit <= 0 || queryText == null || queryText.isBlank()) {
            return List.of();
        }

        List<LexicalHit> hits = new ArrayList<>();
        for (Map.Entry<ContentKey, Double> scored : lexicalIndex.search(queryText).entrySet()) {
            ContentKey key = scored.getKey();
            if (types != null && !types.isEmpty() && !types.contains(key.contentType())) {
                continue;
            }
            IndexedContent content = store.get(key);
            if (content == null || !content.hasLexical()) {
                continue;
            }
            if (!MetadataFilter.allMatch(filters, content.getMetadata())) {
                continue;
            }
            double rank = scored.getValue();
            if (rank <= 0.0) {
                continue;
            }
            hits.add(new LexicalHit(
                key,
                rank,
                content.getLexical().getTitle(),
                content.getLexical().getDescription(),
                content.getMetadata()
            ));
        }
        hits.sort(ORDER);
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }
}
