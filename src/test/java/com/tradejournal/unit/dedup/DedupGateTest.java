package com.tradejournal.unit.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.dedup.DedupGate;
import com.tradejournal.dedup.TradeKey;
import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DedupGateTest {

    private static PartialTrade trade(String pnl) {
        return PartialTrade.builder()
                .entryTimestamp(Instant.parse("2025-11-18T18:02:12Z"))
                .ticker("NQ")
                .side("Long")
                .type("Market")
                .quantity(new BigDecimal("2"))
                .pnl(new BigDecimal(pnl))
                .change("Filled")
                .build();
    }

    @Nested
    @DisplayName("TradeKey")
    class Keys {

        @Test
        @DisplayName("Joins normalized fields with '|' in a fixed order")
        void format() {
            assertThat(TradeKey.of(trade("196")))
                    .isEqualTo("2025-11-18T18:02:12.000Z|nq|long|market|2.0000|196.0000|filled");
        }

        @Test
        @DisplayName("Absent values contribute empty segments")
        void absentValues() {
            PartialTrade bare = PartialTrade.builder().ticker("NQ").build();

            assertThat(TradeKey.of(bare)).isEqualTo("|nq|||||");
        }

        @Test
        @DisplayName("Case and numeric scale do not change the key")
        void caseAndScaleInsensitive() {
            TradeRecord stored = TradeRecord.builder()
                    .entryTimestamp(Instant.parse("2025-11-18T18:02:12Z"))
                    .ticker("nq")
                    .side("LONG")
                    .type("market")
                    .quantity(new BigDecimal("2.0"))
                    .pnl(new BigDecimal("196.00004"))
                    .change("FILLED")
                    .build();

            assertThat(TradeKey.of(stored)).isEqualTo(TradeKey.of(trade("196")));
        }
    }

    @Nested
    @DisplayName("admit")
    class Admit {

        @Test
        @DisplayName("Trades already stored are rejected")
        void rejectsStored() {
            TradeRecord stored = TradeRecord.builder()
                    .entryTimestamp(Instant.parse("2025-11-18T18:02:12Z"))
                    .ticker("NQ")
                    .side("Long")
                    .type("Market")
                    .quantity(new BigDecimal("2"))
                    .pnl(new BigDecimal("196"))
                    .change("Filled")
                    .build();
            DedupGate gate = new DedupGate(List.of(stored));

            assertThat(gate.admit(trade("196"))).isFalse();
            assertThat(gate.admit(trade("-50"))).isTrue();
            assertThat(gate.rejectedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A repeat within the same batch is rejected")
        void rejectsRepeatInBatch() {
            DedupGate gate = new DedupGate(List.of());

            assertThat(gate.admit(trade("10"))).isTrue();
            assertThat(gate.admit(trade("10"))).isFalse();
            assertThat(gate.rejectedCount()).isEqualTo(1);
        }
    }
}
