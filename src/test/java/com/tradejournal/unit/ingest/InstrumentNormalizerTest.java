package com.tradejournal.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.InstrumentConfig;
import com.tradejournal.ingest.InstrumentNormalizer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstrumentNormalizerTest {

    private InstrumentNormalizer instrumentNormalizer;

    @BeforeEach
    void setUp() {
        instrumentNormalizer = new InstrumentNormalizer(new InstrumentConfig());
    }

    @Test
    @DisplayName("Market alias anywhere in the text collapses to its root")
    void marketAlias() {
        assertThat(instrumentNormalizer.normalize("CME_MINI:NQ1!")).isEqualTo("NQ");
        assertThat(instrumentNormalizer.multiplierFor("NQ")).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("Longer roots are tested first so MNQ is not read as NQ")
    void longestRootFirst() {
        assertThat(instrumentNormalizer.normalize("MNQZ5")).isEqualTo("MNQ");
        assertThat(instrumentNormalizer.normalize("nqh6")).isEqualTo("NQ");
        assertThat(instrumentNormalizer.multiplierFor("MNQ")).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Unknown instruments pass through trimmed with a multiplier of 1")
    void unknownInstrument() {
        assertThat(instrumentNormalizer.normalize("  AAPL ")).isEqualTo("AAPL");
        assertThat(instrumentNormalizer.multiplierFor("AAPL")).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(instrumentNormalizer.normalize(null)).isEmpty();
        assertThat(instrumentNormalizer.multiplierFor("")).isEqualByComparingTo(BigDecimal.ONE);
    }

    @Test
    @DisplayName("Contracts added through configuration are recognised")
    void configuredContract() {
        InstrumentConfig config = new InstrumentConfig();
        List<InstrumentConfig.Contract> contracts = new ArrayList<>(config.getContracts());
        contracts.add(new InstrumentConfig.Contract("ES", new BigDecimal("50"), List.of("CME_MINI:ES")));
        config.setContracts(contracts);
        InstrumentNormalizer normalizer = new InstrumentNormalizer(config);

        assertThat(normalizer.normalize("ESZ5")).isEqualTo("ES");
        assertThat(normalizer.multiplierFor("ES")).isEqualByComparingTo("50");
    }
}
