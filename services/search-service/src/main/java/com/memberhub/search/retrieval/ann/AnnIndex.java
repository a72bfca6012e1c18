package com.memberhub.search.retrieval.ann;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.IndexedContent;
import com.memberhub.search.retrieval.VectorMath;
import com.memberhub.search.retrieval.VectorSearchProperties;
import io.github.jbellis.jvector.graph.GraphIndex;
import io.github.jbellis.jvector.graph.GraphIndexBuilder;
import io.github.jbellis.jvector.graph.GraphSearcher;
import io.github.jbellis.jvector.graph.ListRandomAccessVectorValues;
import io.github.jbellis.jvector.graph.RandomAccessVectorValues;
import io.github.jbellis.jvector.graph.SearchResult;
import io.github.jbellis.jvector.graph.similarity.BuildScoreProvider;
import io.github.jbellis.jvector.util.Bits;
import io.github.jbellis.jvector.vector.VectorSimilarityFunction;
import io.github.jbellis.jvector.vector.VectorizationProvider;
import io.github.jbellis.jvector.vector.types.VectorFloat;
import io.github.jbellis.jvector.vector.types.VectorTypeSupport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class AnnIndex {
    private static final VectorTypeSupport VECTOR_TYPES = VectorizationProvider.getInstance().getVectorTypeSupport();

    private final long generation;
    private final Instant builtAt;
    private final List<ContentKey> keysByOrdinal;
    private final Map<ContentKey, Long> revisions;
    private final RandomAccessVectorValues vectors;
    private final GraphIndex graph;

    private AnnIndex(
        long generation,
        Instant builtAt,
        List<ContentKey> keysByOrdinal,
        Map<ContentKey, Long> revisions,
        RandomAccessVectorValues vectors,
        GraphIndex graph
    ) {
        this.generation = generation;
        this.builtAt = builtAt;
        this.keysByOrdinal = keysByOrdinal;
        this.revisions = revisions;
        this.vectors = vectors;
        this.graph = graph;
    }

    public static AnnIndex build(
        long generation,
        Instant builtAt,
        Collection<IndexedContent> contents,
        int dimension,
        VectorSearchProperties.Ann settings
    ) {
        List<ContentKey> keys = new ArrayList<>();
        Map<ContentKey, Long> revisions = new HashMap<>();
        List<VectorFloat<?>> vectorList = new ArrayList<>();
        for (IndexedContent content : contents) {
            float[] vector = content.vectorView();
            if (vector == null || vector.length != dimension) {
                continue;
            }
            // zero vectors never match, but count as indexed so they stop showing as pending
            revisions.put(content.getKey(), content.getVectorRevision());
            if (VectorMath.isZero(vector)) {
                continue;
            }
            keys.add(content.getKey());
            vectorList.add(VECTOR_TYPES.createFloatVector(vector));
        }
        if (keys.isEmpty()) {
            return new AnnIndex(generation, builtAt, List.of(), Collections.unmodifiableMap(revisions), null, null);
        }

        RandomAccessVectorValues ravv = new ListRandomAccessVectorValues(vectorList, dimension);
        BuildScoreProvider scoreProvider = BuildScoreProvider.randomAccessScoreProvider(
            ravv,
            VectorSimilarityFunction.COSINE
        );
        GraphIndex graph;
        try {
            graph = buildGraph(scoreProvider, ravv, dimension, settings);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to build vector graph", e);
        }
        return new AnnIndex(
            generation,
            builtAt,
            Collections.unmodifiableList(keys),
            Collections.unmodifiableMap(revisions),
            ravv,
            graph
        );
    }

    private static GraphIndex buildGraph(
        BuildScoreProvider scoreProvider,
        RandomAccessVectorValues ravv,
        int dimension,
        VectorSearchProperties.Ann settings
    ) throws IOException {
        try (GraphIndexBuilder builder = new GraphIndexBuilder(
            scoreProvider,
            dimension,
            Math.max(2, settings.getMaxDegree()),
            Math.max(10, settings.getBeamWidth()),
            settings.getNeighborOverflow(),
            settings.getAlpha()
        )) {
            return builder.build(ravv);
        }
    }

    public List<ContentKey> search(float[] query, int candidates) {
        if (graph == null || candidates <= 0) {
            return List.of();
        }
        if (VectorMath.isZero(query)) {
            return List.of();
        }
        int topK = Math.min(candidates, keysByOrdinal.size());
        VectorFloat<?> queryVector = VECTOR_TYPES.createFloatVector(query.clone());
        SearchResult result = GraphSearcher.search(
            queryVector,
            topK,
            vectors,
            VectorSimilarityFunction.COSINE,
            graph,
            Bits.ALL
        );
        List<ContentKey> keys = new ArrayList<>(topK);
        for (SearchResult.NodeScore node : result.getNodes()) {
            keys.add(keysByOrdinal.get(node.node));
        }
        return keys;
    }

    public long getGeneration() {
        return generation;
    }

    public Instant getBuiltAt() {
        return builtAt;
    }

    public int size() {
        return keysByOrdinal.size();
    }

    public Map<ContentKey, Long> getRevisions() {
        return revisions;
    }
}
