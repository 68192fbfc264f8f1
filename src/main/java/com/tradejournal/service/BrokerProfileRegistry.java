package com.tradejournal.service;

import com.tradejournal.config.BrokerCatalogConfig;
import com.tradejournal.domain.enums.PnlSource;
import com.tradejournal.domain.enums.SideConvention;
import com.tradejournal.domain.model.BrokerProfile;
import com.tradejournal.domain.model.SchemaColumn;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Catalog of known statement sources, looked up by name without regard to case.
 *
 * <p>A {@code Default} profile always exists; brokers nobody configured resolve to it and are
 * treated as exporting one realized P&amp;L figure per row. Profiles without their own
 * instructions get the catalog's default instructions.
 */
@Service
public class BrokerProfileRegistry {

    private static final Logger log = LoggerFactory.getLogger(BrokerProfileRegistry.class);

    private final Map<String, BrokerProfile> profiles = new LinkedHashMap<>();
    private final BrokerProfile defaultProfile;

    public BrokerProfileRegistry(BrokerCatalogConfig brokerCatalogConfig) {
        List<String> defaultInstructions = List.copyOf(brokerCatalogConfig.getDefaultInstructions());
        for (BrokerCatalogConfig.Profile entry : brokerCatalogConfig.getProfiles()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                log.warn("Skipping broker profile without a name: filePattern={}", entry.getFilePattern());
                continue;
            }
            BrokerProfile profile = toProfile(entry, defaultInstructions);
            profiles.put(key(profile.getName()), profile);
        }
        this.defaultProfile = profiles.computeIfAbsent(key(BrokerProfile.DEFAULT_NAME), name -> BrokerProfile.builder()
                .name(BrokerProfile.DEFAULT_NAME)
                .pnlSource(PnlSource.TRADE_PNL)
                .sideConvention(SideConvention.LONG_SHORT)
                .instructions(defaultInstructions)
                .build());
        log.info("Broker catalog loaded: profiles={}", profiles.size());
    }

    /** Configured broker names in catalog order, {@code Default} included. */
    public List<String> brokerNames() {
        return profiles.values().stream().map(BrokerProfile::getName).toList();
    }

    public Optional<BrokerProfile> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(key(name)));
    }

    /** The named profile, or {@code Default} when the name is unknown. */
    public BrokerProfile resolve(String name) {
        return find(name).orElse(defaultProfile);
    }

    public BrokerProfile getDefaultProfile() {
        return defaultProfile;
    }

    private static BrokerProfile toProfile(BrokerCatalogConfig.Profile entry, List<String> defaultInstructions) {
        List<SchemaColumn> columns = new ArrayList<>();
        for (BrokerCatalogConfig.Column column : entry.getColumns()) {
            columns.add(SchemaColumn.builder()
                    .label(column.getLabel())
                    .description(column.getDescription())
                    .required(column.isRequired())
                    .sample(column.getSample())
                    .mapsTo(column.getMapsTo())
                    .build());
        }
        List<String> instructions = entry.getInstructions() == null || entry.getInstructions().isEmpty()
                ? defaultInstructions
                : List.copyOf(entry.getInstructions());
        return BrokerProfile.builder()
                .name(entry.getName().trim())
                .filePattern(entry.getFilePattern())
                .notes(entry.getNotes())
                .pnlSource(entry.getPnlSource() != null ? entry.getPnlSource() : PnlSource.TRADE_PNL)
                .sideConvention(entry.getSideConvention() != null ? entry.getSideConvention() : SideConvention.LONG_SHORT)
                .instructions(instructions)
                .columns(List.copyOf(columns))
                .build();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
