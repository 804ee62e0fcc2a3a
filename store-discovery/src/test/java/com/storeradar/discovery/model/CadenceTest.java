package com.storeradar.discovery.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CadenceTest {

    @Test
    void broadestCadenceWins() {
        assertThat(Cadence.broadest(null, Cadence.FAST)).isEqualTo(Cadence.FAST);
        assertThat(Cadence.broadest(Cadence.FAST, Cadence.DEEP)).isEqualTo(Cadence.DEEP);
        assertThat(Cadence.broadest(Cadence.COMPREHENSIVE, Cadence.FAST)).isEqualTo(Cadence.COMPREHENSIVE);
        assertThat(Cadence.broadest(Cadence.COMPREHENSIVE, Cadence.MANUAL)).isEqualTo(Cadence.COMPREHENSIVE);
        assertThat(Cadence.broadest(Cadence.MANUAL, Cadence.COMPREHENSIVE)).isEqualTo(Cadence.MANUAL);
    }

    @Test
    void parsesCaseInsensitively() {
        assertThat(Cadence.parse(" deep ")).isEqualTo(Cadence.DEEP);
        assertThat(Cadence.parse(null)).isEqualTo(Cadence.MANUAL);
        assertThat(Cadence.parse("")).isEqualTo(Cadence.MANUAL);
        assertThatThrownBy(() -> Cadence.parse("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FAST");
    }
}
