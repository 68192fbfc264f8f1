package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.PnlSource;
import com.tradejournal.domain.enums.SideConvention;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * A statement source and its conventions.
 *
 * <p>{@link #getPnlSource()} decides whether rows go through FIFO reconciliation. Everything
 * else is documentation for the user preparing the export.
 */
@Getter
@Builder
public class BrokerProfile {

    public static final String DEFAULT_NAME = "Default";

    private final String name;
    private final String filePattern;
    private final String notes;
    private final PnlSource pnlSource;
    private final SideConvention sideConvention;

    @Builder.Default
    private final List<String> instructions = List.of();

    @Builder.Default
    private final List<SchemaColumn> columns = List.of();

    public boolean reconcilesFills() {
        return pnlSource != null && pnlSource.requiresReconciliation();
    }
}
