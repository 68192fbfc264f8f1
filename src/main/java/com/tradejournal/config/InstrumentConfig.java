package com.tradejournal.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Contract table used to canonicalize ticker text and look up per-point dollar multipliers.
 *
 * <p>Adding an instrument is a configuration change under {@code tradejournal.instruments.contracts};
 * nothing in the reconciler needs to know about it. Unknown instruments get a multiplier of 1.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.instruments")
@Getter
@Setter
public class InstrumentConfig {

    private List<Contract> contracts = new ArrayList<>(List.of(
            new Contract("NQ", new BigDecimal("20"), new ArrayList<>(List.of("CME_MINI:NQ"))),
            new Contract("MNQ", BigDecimal.ONE, new ArrayList<>())));

    /**
     * One futures root and how statements refer to it.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Contract {

        /** Canonical root symbol, e.g. "NQ". Raw symbols starting with it collapse to it. */
        private String root;

        /** Dollar value of a one-point move for one contract. */
        private BigDecimal multiplier = BigDecimal.ONE;

        /** Exchange-qualified identifiers (e.g. "CME_MINI:NQ") that collapse to the root wherever they appear. */
        private List<String> marketAliases = new ArrayList<>();
    }
}
