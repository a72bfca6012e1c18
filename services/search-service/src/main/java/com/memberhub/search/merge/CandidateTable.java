package com.memberhub.search.merge;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.SemanticHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

final class CandidateTable {
    private static final Comparator<MutableCandidate> ORDER = Comparator
        .comparingDouble(MutableCandidate::getScore).reversed()
        .thenComparing(Comparator.comparingDouble(MutableCandidate::getSemanticSimilarity).reversed())
        .thenComparing(MutableCandidate::getKey);

    private final Map<ContentKey, MutableCandidate> candidates = new HashMap<>();

    void addLexical(List<LexicalHit> hits, ContributionFunction contribution) {
        for (int i = 0; i < hits.size(); i++) {
            LexicalHit hit = hits.get(i);
            MutableCandidate candidate = candidates.computeIfAbsent(hit.key(), MutableCandidate::new);
            candidate.keywordRank = hit.rank();
            candidate.lexicalPosition = i + 1;
            candidate.score += contribution.apply(hit.rank(), i + 1);
            candidate.title = hit.title();
            candidate.description = hit.description();
            candidate.metadata = hit.metadata();
        }
    }

    void addSemantic(List<SemanticHit> hits, ContributionFunction contribution) {
        for (int i = 0; i < hits.size(); i++) {
            SemanticHit hit = hits.get(i);
            MutableCandidate candidate = candidates.computeIfAbsent(hit.key(), MutableCandidate::new);
            candidate.semanticSimilarity = hit.similarity();
            candidate.semanticPosition = i + 1;
            candidate.score += contribution.apply(hit.similarity(), i + 1);
            if (candidate.title == null) {
                candidate.title = hit.title();
            }
            candidate.contentText = hit.contentText();
            candidate.metadata = hit.metadata();
        }
    }

    List<FusedHit> top(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<MutableCandidate> ordered = new ArrayList<>(candidates.values());
        ordered.sort(ORDER);
        int size = Math.min(limit, ordered.size());
        List<FusedHit> fused = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            MutableCandidate candidate = ordered.get(i);
            fused.add(new FusedHit(
                candidate.key,
                candidate.score,
                candidate.keywordRank,
                candidate.semanticSimilarity,
                candidate.lexicalPosition,
                candidate.semanticPosition,
                candidate.title,
                candidate.description,
                candidate.contentText,
                candidate.metadata
            ));
        }
        return fused;
    }

    static <T> double[] minMax(List<T> hits, ToDoubleFunction<T> score) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (T hit : hits) {
            double value = score.applyAsDouble(hit);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new double[] {min, max};
    }

    @FunctionalInterface
    interface ContributionFunction {
        double apply(double rawScore, int position);
    }

    private static final class MutableCandidate {
        private final ContentKey key;
        private double score;
        private double keywordRank;
        private double semanticSimilarity;
        private Integer lexicalPosition;
        private Integer semanticPosition;
        private String title;
        private String description;
        private String contentText;
        private Map<String, Object> metadata;

        private MutableCandidate(ContentKey key) {
            this.key = key;
        }

        private ContentKey getKey() {
            return key;
        }

        private double getScore() {
            return score;
        }

        private double getSemanticSimilarity() {
            return semanticSimilarity;
        }
    }
}
