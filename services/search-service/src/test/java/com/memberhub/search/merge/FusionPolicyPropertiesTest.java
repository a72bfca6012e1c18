package com.memberhub.search.merge;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FusionPolicyPropertiesTest {

    @Test
    void candidateDepthIsBoundedButNeverBelowLimit() {
        FusionPolicyProperties properties = new FusionPolicyProperties();

        assertThat(properties.candidatesFor(10)).isEqualTo(100);
        assertThat(properties.candidatesFor(50)).isEqualTo(250);
        assertThat(properties.candidatesFor(400)).isEqualTo(1000);

        properties.setMaxCandidates(20);
        properties.setMinCandidates(5);
        assertThat(properties.candidatesFor(30)).isEqualTo(30);
    }

    @Test
    void methodNamesAcceptCommonAliases() {
        assertThat(FusionMethod.fromString("RRF")).isEqualTo(FusionMethod.RRF);
        assertThat(FusionMethod.fromString("reciprocal_rank")).isEqualTo(FusionMethod.RRF);
        assertThat(FusionMethod.fromString("min_max")).isEqualTo(FusionMethod.NORMALIZED);
        assertThat(FusionMethod.fromString(" weighted ")).isEqualTo(FusionMethod.WEIGHTED);
        assertThat(FusionMethod.fromString("linear")).isEqualTo(FusionMethod.WEIGHTED);
        assertThat(FusionMethod.fromString("")).isNull();
        assertThat(FusionMethod.fromString("magic")).isNull();
        assertThat(FusionMethod.fromString("whatever")).isNull();
        assertThat(FusionMethod.fromString("wrong")).isNull();
        assertThat(FusionMethod.fromString("normal")).isNull();
        assertThat(FusionMethod.fromString("not_rrf")).isNull();
        assertThat(FusionMethod.fromString("Reciprocal-Rank-Fusion")).isEqualTo(FusionMethod.RRF);
    }
}
