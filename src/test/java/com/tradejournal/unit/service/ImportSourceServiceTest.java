package com.tradejournal.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.tradejournal.domain.model.ImportSource;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.exception.StorageException;
import com.tradejournal.repository.TradeRecordStore;
import com.tradejournal.service.ImportSourceService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImportSourceServiceTest {

    @Mock
    private TradeRecordStore tradeRecordStore;

    private ImportSourceService importSourceService;

    @BeforeEach
    void setUp() {
        importSourceService = new ImportSourceService(tradeRecordStore);
    }

    private static TradeRecord trade(String account, String broker, String timestamp) {
        return TradeRecord.builder()
                .ownerId("local")
                .sourceAccount(account)
                .sourceBroker(broker)
                .entryTimestamp(timestamp == null ? null : Instant.parse(timestamp))
                .build();
    }

    @Test
    @DisplayName("Groups by account and broker, newest first, untimed sources last")
    void groupsAndSorts() {
        when(tradeRecordStore.findByOwner("local"))
                .thenReturn(List.of(
                        trade("Apex", "Tradovate", "2025-11-01T10:00:00Z"),
                        trade("Paper", "TradingView", null),
                        trade("Apex", "Tradovate", "2025-11-20T10:00:00Z"),
                        trade("Swing", "Generic CSV Format", "2025-11-10T10:00:00Z"),
                        trade("", "Tradovate", "2025-12-01T10:00:00Z")));

        List<ImportSource> sources = importSourceService.listSources("local");

        assertThat(sources).extracting(ImportSource::getKey)
                .containsExactly("Apex::Tradovate", "Swing::Generic CSV Format", "Paper::TradingView");
        ImportSource apex = sources.get(0);
        assertThat(apex.getLastUpdated()).isEqualTo(Instant.parse("2025-11-20T10:00:00Z"));
        assertThat(apex.getTradeCount()).isEqualTo(2);
        assertThat(apex.getType()).isEqualTo("Statement");
        assertThat(apex.getDetails()).isEqualTo("Broker: Tradovate");
        assertThat(sources.get(2).getLastUpdated()).isNull();
    }

    @Test
    @DisplayName("Missing broker is reported as Unknown")
    void unknownBroker() {
        when(tradeRecordStore.findByOwner("local")).thenReturn(List.of(trade("Apex", null, null)));

        assertThat(importSourceService.listSources("local"))
                .singleElement()
                .extracting(ImportSource::getBroker)
                .isEqualTo("Unknown");
    }

    @Test
    @DisplayName("Deleting a source returns the number of trades removed, zero included")
    void deleteSource() {
        when(tradeRecordStore.deleteByAccount("local", "Apex")).thenReturn(12);
        when(tradeRecordStore.deleteByAccount("local", "Nothing")).thenReturn(0);

        assertThat(importSourceService.deleteSource("local", "Apex")).isEqualTo(12);
        assertThat(importSourceService.deleteSource("local", "Nothing")).isZero();
    }

    @Test
    @DisplayName("Delete failure surfaces as a StorageException")
    void deleteFailure() {
        when(tradeRecordStore.deleteByAccount("local", "Apex")).thenThrow(new StorageException("locked", null));

        assertThatThrownBy(() -> importSourceService.deleteSource("local", "Apex"))
                .isInstanceOf(StorageException.class)
                .hasMessage("Unable to delete trades: locked");
    }
}
