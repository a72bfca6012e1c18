package com.memberhub.search.merge;

import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.SemanticHit;
import java.util.List;

public final class RrfFusion {
    private RrfFusion() {
    }

    public static List<FusedHit> fuse(List<LexicalHit> lexical, List<SemanticHit> semantic, int k, int limit) {
        return fuse(lexical, semantic, k, 1.0, 1.0, limit);
    }

    public static List<FusedHit> fuse(
        List<LexicalHit> lexical,
        List<SemanticHit> semantic,
        int k,
        double keywordWeight,
        double semanticWeight,
        int limit
    ) {
        int smoothing = Math.max(0, k);
        CandidateTable table = new CandidateTable();
        table.addLexical(lexical, (score, position) -> keywordWeight / (smoothing + position));
        table.addSemantic(semantic, (score, position) -> semanticWeight / (smoothing + position));
        return table.top(limit);
    }
}
