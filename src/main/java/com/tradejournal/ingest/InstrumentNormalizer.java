package com.tradejournal.ingest;

import com.tradejournal.config.InstrumentConfig;
import com.tradejournal.config.InstrumentConfig.Contract;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Collapses broker-specific contract text ("MNQZ5", "CME_MINI:NQ1!") to a root symbol and
 * supplies that root's dollar multiplier.
 *
 * <p>Market aliases are checked first, anywhere in the text. Roots are then matched as
 * prefixes, longest first, so "MNQ" is never mistaken for "NQ". Text matching nothing is
 * returned trimmed with a multiplier of 1.
 */
@Component
public class InstrumentNormalizer {

    private final List<Contract> contractsByRootLength;

    public InstrumentNormalizer(InstrumentConfig instrumentConfig) {
        this.contractsByRootLength = instrumentConfig.getContracts().stream()
                .filter(contract -> contract.getRoot() != null && !contract.getRoot().isBlank())
                .sorted(Comparator.comparingInt((Contract contract) -> contract.getRoot().length())
                        .reversed())
                .toList();
    }

    public String normalize(String rawTicker) {
        if (rawTicker == null) {
            return "";
        }
        String trimmed = rawTicker.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (Contract contract : contractsByRootLength) {
            for (String alias : contract.getMarketAliases()) {
                if (upper.contains(alias.toUpperCase(Locale.ROOT))) {
                    return contract.getRoot();
                }
            }
        }
        for (Contract contract : contractsByRootLength) {
            if (upper.startsWith(contract.getRoot().toUpperCase(Locale.ROOT))) {
                return contract.getRoot();
            }
        }
        return trimmed;
    }

    /** Dollar value of a one-point move per contract. Expects a normalized ticker. */
    public BigDecimal multiplierFor(String ticker) {
        if (ticker == null || ticker.isEmpty()) {
            return BigDecimal.ONE;
        }
        String root = normalize(ticker);
        return contractsByRootLength.stream()
                .filter(contract -> contract.getRoot().equalsIgnoreCase(root))
                .map(Contract::getMultiplier)
                .filter(multiplier -> multiplier != null && multiplier.signum() > 0)
                .findFirst()
                .orElse(BigDecimal.ONE);
    }
}
