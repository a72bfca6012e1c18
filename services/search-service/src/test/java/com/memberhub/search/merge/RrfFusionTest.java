package com.memberhub.search.merge;

import static com.memberhub.search.merge.WeightedFusionTest.lexical;
import static com.memberhub.search.merge.WeightedFusionTest.semantic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import java.util.List;
import org.junit.jupiter.api.Test;

class RrfFusionTest {
    private static final ContentKey A = ContentKey.of(ContentType.DOCUMENT, "a");
    private static final ContentKey B = ContentKey.of(ContentType.DOCUMENT, "b");
    private static final ContentKey C = ContentKey.of(ContentType.DOCUMENT, "c");

    @Test
    void scoresDependOnPositionsNotRawScores() {
        List<FusedHit> fused = RrfFusion.fuse(
            List.of(lexical(A, 40.0), lexical(B, 0.1)),
            List.of(semantic(B, 0.99), semantic(C, 0.2)),
            60,
            10
        );

        assertThat(fused).extracting(FusedHit::getKey).containsExactly(B, A, C);
        assertThat(fused.get(0).getCombinedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
        assertThat(fused.get(1).getCombinedScore()).isCloseTo(1.0 / 61, within(1e-12));
        assertThat(fused.get(2).getCombinedScore()).isCloseTo(1.0 / 62, within(1e-12));
        assertThat(fused.get(0).getKeywordRank()).isEqualTo(0.1);
        assertThat(fused.get(0).getSemanticSimilarity()).isEqualTo(0.99);
    }

    @Test
    void weightsScaleEachSide() {
        List<FusedHit> fused = RrfFusion.fuse(
            List.of(lexical(A, 1.0)),
            List.of(semantic(C, 0.5)),
            1,
            0.0,
            1.0,
            10
        );

        assertThat(fused).extracting(FusedHit::getKey).containsExactly(C, A);
        assertThat(fused.get(0).getCombinedScore()).isEqualTo(0.5);
        assertThat(fused.get(1).getCombinedScore()).isZero();
    }

    @Test
    void tiedFirstPlacesPreferSemanticMatch() {
        List<FusedHit> fused = RrfFusion.fuse(List.of(lexical(A, 5.0)), List.of(semantic(B, 0.4)), 60, 10);

        assertThat(fused).extracting(FusedHit::getKey).containsExactly(B, A);
    }
}
