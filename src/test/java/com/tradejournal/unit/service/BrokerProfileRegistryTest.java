package com.tradejournal.unit.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.BrokerCatalogConfig;
import com.tradejournal.domain.enums.PnlSource;
import com.tradejournal.domain.model.BrokerProfile;
import com.tradejournal.service.BrokerProfileRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BrokerProfileRegistryTest {

    private BrokerProfileRegistry brokerProfileRegistry;

    @BeforeEach
    void setUp() {
        BrokerCatalogConfig catalog = new BrokerCatalogConfig();
        catalog.setDefaultInstructions(List.of("Export your history as CSV."));

        BrokerCatalogConfig.Column symbol = new BrokerCatalogConfig.Column();
        symbol.setLabel("Symbol");
        symbol.setMapsTo("ticker");
        symbol.setRequired(true);

        BrokerCatalogConfig.Profile tradovate = new BrokerCatalogConfig.Profile();
        tradovate.setName("Tradovate");
        tradovate.setPnlSource(PnlSource.FILLS);
        tradovate.setInstructions(List.of("Log into Tradovate."));
        tradovate.setColumns(List.of(symbol));

        BrokerCatalogConfig.Profile generic = new BrokerCatalogConfig.Profile();
        generic.setName("Generic CSV Format");

        BrokerCatalogConfig.Profile unnamed = new BrokerCatalogConfig.Profile();

        catalog.setProfiles(List.of(tradovate, generic, unnamed));
        brokerProfileRegistry = new BrokerProfileRegistry(catalog);
    }

    @Test
    @DisplayName("Lists configured brokers in order and always includes Default")
    void brokerNames() {
        assertThat(brokerProfileRegistry.brokerNames()).containsExactly("Tradovate", "Generic CSV Format", "Default");
    }

    @Test
    @DisplayName("Lookup ignores case and surrounding whitespace")
    void caseInsensitiveLookup() {
        BrokerProfile profile = brokerProfileRegistry.resolve("  tradovate ");

        assertThat(profile.getName()).isEqualTo("Tradovate");
        assertThat(profile.reconcilesFills()).isTrue();
        assertThat(profile.getColumns()).singleElement().satisfies(column -> {
            assertThat(column.getLabel()).isEqualTo("Symbol");
            assertThat(column.isRequired()).isTrue();
        });
    }

    @Test
    @DisplayName("Unknown brokers resolve to Default, which does not reconcile fills")
    void unknownFallsBackToDefault() {
        BrokerProfile profile = brokerProfileRegistry.resolve("Interactive Brokers");

        assertThat(profile.getName()).isEqualTo(BrokerProfile.DEFAULT_NAME);
        assertThat(profile.reconcilesFills()).isFalse();
        assertThat(brokerProfileRegistry.find("Interactive Brokers")).isEmpty();
    }

    @Test
    @DisplayName("Profiles without instructions get the default instructions")
    void defaultInstructions() {
        assertThat(brokerProfileRegistry.resolve("Generic CSV Format").getInstructions())
                .containsExactly("Export your history as CSV.");
        assertThat(brokerProfileRegistry.resolve("Tradovate").getInstructions()).containsExactly("Log into Tradovate.");
        assertThat(brokerProfileRegistry.getDefaultProfile().getInstructions())
                .containsExactly("Export your history as CSV.");
    }
}
