package com.memberhub.search.merge;

import com.memberhub.search.retrieval.LexicalHit;
import com.memberhub.search.retrieval.SemanticHit;
import java.util.List;

public final class WeightedFusion {
    private WeightedFusion() {
    }

    public static List<FusedHit> fuse(
        List<LexicalHit> lexical,
        List<SemanticHit> semantic,
        double keywordWeight,
        double semanticWeight,
        int limit
    ) {
        CandidateTable table = new CandidateTable();
        table.addLexical(lexical, (score, position) -> score * keywordWeight);
        table.addSemantic(semantic, (score, position) -> score * semanticWeight);
        return table.top(limit);
    }

    public static List<FusedHit> fuseNormalized(
        List<LexicalHit> lexical,
        List<SemanticHit> semantic,
        double keywordWeight,
        double semanticWeight,
        int limit
    ) {
        double[] lexicalRange = CandidateTable.minMax(lexical, LexicalHit::rank);
        double[] semanticRange = CandidateTable.minMax(semantic, SemanticHit::similarity);
        CandidateTable table = new CandidateTable();
        table.addLexical(lexical, (score, position) -> normalize(score, lexicalRange) * keywordWeight);
        table.addSemantic(semantic, (score, position) -> normalize(score, semanticRange) * semanticWeight);
        return table.top(limit);
    }

    static double normalize(double value, double[] range) {
        double span = range[1] - range[0];
        if (span <= 0.0) {
            return 1.0;
        }
        return (value - range[0]) / span;
    }
}
