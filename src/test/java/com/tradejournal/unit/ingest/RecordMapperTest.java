package com.tradejournal.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.ImportConfig;
import com.tradejournal.config.InstrumentConfig;
import com.tradejournal.domain.model.MappedRow;
import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.ingest.InstrumentNormalizer;
import com.tradejournal.ingest.RawRecord;
import com.tradejournal.ingest.RecordMapper;
import com.tradejournal.ingest.StatementCsvReader;
import com.tradejournal.ingest.TimestampReconstructor;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecordMapperTest {

    private RecordMapper recordMapper;
    private StatementCsvReader statementCsvReader;

    @BeforeEach
    void setUp() {
        recordMapper = new RecordMapper(
                new TimestampReconstructor(new ImportConfig()), new InstrumentNormalizer(new InstrumentConfig()));
        statementCsvReader = new StatementCsvReader();
    }

    private List<MappedRow> map(String csv) {
        List<RawRecord> records = statementCsvReader.read(csv);
        return recordMapper.mapAll(records);
    }

    @Nested
    @DisplayName("Fill-level exports")
    class Fills {

        @Test
        @DisplayName("TradingView row maps ticker, side, quantity, status and fill metadata")
        void tradingViewRow() {
            List<MappedRow> rows = map("Symbol,Side,Type,Qty,Fill Price,Status,Commission,Placing Time,Closing Time\n"
                    + "CME_MINI:NQ1!,Sell,Market,-2,\"24,576.50\",Filled,4,2025-11-18T18:00:00Z,2025-11-18T18:02:12Z\n");

            assertThat(rows).hasSize(1);
            PartialTrade trade = rows.get(0).getTrade();
            assertThat(trade.getTicker()).isEqualTo("NQ");
            assertThat(trade.getSide()).isEqualTo("Short");
            assertThat(trade.getType()).isEqualTo("Market");
            assertThat(trade.getQuantity()).isEqualByComparingTo("2");
            assertThat(trade.getChange()).isEqualTo("Filled");
            assertThat(trade.getEntryTimestamp()).isEqualTo(Instant.parse("2025-11-18T18:02:12Z"));
            assertThat(trade.getDate()).isEqualTo("2025-11-18");
            assertThat(trade.getTime()).isEqualTo("18:02");

            var meta = rows.get(0).getMeta();
            assertThat(meta.getFillPrice()).isEqualByComparingTo("24576.50");
            assertThat(meta.getTotalFee()).isEqualByComparingTo("4");
            assertThat(meta.getFeePerUnit()).isEqualByComparingTo("2");
            assertThat(meta.getMultiplier()).isEqualByComparingTo("20");
        }

        @Test
        @DisplayName("Status text in the P&L fallback column parses to no P&L")
        void statusIsNotPnl() {
            List<MappedRow> rows = map("Symbol,Side,Qty,Status\nNQ,Buy,1,Filled\n");

            assertThat(rows.get(0).getTrade().getPnl()).isNull();
        }
    }

    @Nested
    @DisplayName("Trade-level exports")
    class TradeLevel {

        @Test
        @DisplayName("Generic CSV keeps the P&L column and builds the timestamp from date and time")
        void genericRow() {
            List<MappedRow> rows = map("Date,Time,Ticker,Side,Asset Type,Quantity,P&L,Status\n"
                    + "2025-11-18,18:02,NQ,Long,Future,1,\"$1,150.25\",Closed\n");

            PartialTrade trade = rows.get(0).getTrade();
            assertThat(trade.getPnl()).isEqualByComparingTo("1150.25");
            assertThat(trade.getType()).isEqualTo("Future");
            assertThat(trade.getChange()).isEqualTo("Closed");
            assertThat(trade.getEntryTimestamp()).isEqualTo(Instant.parse("2025-11-18T18:02:00Z"));
        }

        @Test
        @DisplayName("A numeric change column supplies P&L when no P&L column exists")
        void changeColumnAsPnl() {
            List<MappedRow> rows = map("Ticker,Side,Change\nNQ,Long,-37.5\n");

            assertThat(rows.get(0).getTrade().getPnl()).isEqualByComparingTo("-37.5");
            assertThat(rows.get(0).getTrade().getChange()).isEqualTo("-37.5");
        }

        @Test
        @DisplayName("Unparseable timestamp keeps the raw date and time text")
        void rawDateAndTimeKept() {
            List<MappedRow> rows = map("Date,Time,Ticker,PnL\nsometime,later,NQ,5\n");

            PartialTrade trade = rows.get(0).getTrade();
            assertThat(trade.hasTimestamp()).isFalse();
            assertThat(trade.getDate()).isEqualTo("sometime");
            assertThat(trade.getTime()).isEqualTo("later");
        }

        @Test
        @DisplayName("Unrecognised side text passes through unchanged")
        void unknownSide() {
            List<MappedRow> rows = map("Ticker,Side,PnL\nNQ,Flat,0\n");

            assertThat(rows.get(0).getTrade().getSide()).isEqualTo("Flat");
        }
    }

    @Test
    @DisplayName("Rows with nothing recognisable are dropped")
    void dropsEmptyRows() {
        List<MappedRow> rows = map("Order ID,Leverage,Ticker\n123,10:1,\n456,5:1,NQ\n");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getTrade().getTicker()).isEqualTo("NQ");
    }

    @Test
    @DisplayName("A row with only a quantity is kept")
    void quantityAloneIsContent() {
        Optional<MappedRow> row = recordMapper.map(statementCsvReader.read("Qty\n3\n").get(0));

        assertThat(row).isPresent();
        assertThat(row.get().getMeta().getFeePerUnit()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Oversized text cells are cut to the stored length")
    void longCellsClipped() {
        String longType = "Future " + "x".repeat(3000);
        String longNote = "n".repeat(TradeRecord.MAX_TEXT_LENGTH + 1);
        List<MappedRow> rows = map("Ticker,Side,Type,Quantity,PnL,Status\n"
                + "NQ,Long," + longType + ",1,50," + longNote + "\n");

        PartialTrade trade = rows.get(0).getTrade();
        assertThat(trade.getType()).hasSize(TradeRecord.MAX_TEXT_LENGTH).startsWith("Future x");
        assertThat(trade.getChange()).hasSize(TradeRecord.MAX_TEXT_LENGTH);
        assertThat(trade.getTicker()).isEqualTo("NQ");
        assertThat(trade.getPnl()).isEqualByComparingTo("50");
    }
}
