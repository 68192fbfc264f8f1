package com.tradejournal.config;

import com.tradejournal.domain.enums.PnlSource;
import com.tradejournal.domain.enums.SideConvention;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Broker profiles loaded from brokers.yml via the {@code broker-catalog} prefix.
 *
 * <p>Column schemas and export instructions are documentation shown to users. The only
 * entry that changes parsing is {@code pnl-source}: whether rows are individual fills that
 * need FIFO reconciliation.
 */
@Configuration
@ConfigurationProperties(prefix = "broker-catalog")
@Getter
@Setter
public class BrokerCatalogConfig {

    private List<Profile> profiles = new ArrayList<>();

    /** Shown for brokers whose entry has no instructions of its own. */
    private List<String> defaultInstructions = new ArrayList<>();

    /**
     * A single broker entry in the catalog.
     */
    @Getter
    @Setter
    public static class Profile {

        private String name;
        private String filePattern;
        private String notes;
        private PnlSource pnlSource = PnlSource.TRADE_PNL;
        private SideConvention sideConvention = SideConvention.LONG_SHORT;
        private List<String> instructions = new ArrayList<>();
        private List<Column> columns = new ArrayList<>();
    }

    /**
     * One documented column of a broker export.
     */
    @Getter
    @Setter
    public static class Column {

        private String label;
        private String description;
        private boolean required;
        private String sample;

        /** Trade record field the column feeds; empty for informational columns. */
        private String mapsTo;
    }
}
