package com.tradejournal.service;

import com.tradejournal.dedup.DedupGate;
import com.tradejournal.domain.enums.ImportStatus;
import com.tradejournal.domain.model.BrokerProfile;
import com.tradejournal.domain.model.ImportCommand;
import com.tradejournal.domain.model.ImportResult;
import com.tradejournal.domain.model.MappedRow;
import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.event.StatementImportedEvent;
import com.tradejournal.exception.StorageException;
import com.tradejournal.exception.ValidationException;
import com.tradejournal.ingest.RawRecord;
import com.tradejournal.ingest.RecordMapper;
import com.tradejournal.ingest.StatementCsvReader;
import com.tradejournal.reconciliation.FifoReconciler;
import com.tradejournal.repository.TradeRecordStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one broker statement through the import pipeline:
 * <ol>
 *   <li>parse the CSV and map rows to partial trades</li>
 *   <li>derive P&amp;L by FIFO matching when the broker exports fills</li>
 *   <li>drop rows before the earliest-date cutoff</li>
 *   <li>deduct the per-contract fee override from futures rows</li>
 *   <li>drop trades already stored for the account (or repeated in the file)</li>
 *   <li>insert the survivors in one transaction</li>
 * </ol>
 *
 * <p>Empty statements, fully filtered statements and fully duplicated statements are normal
 * outcomes reported through {@link ImportStatus}. Storage failures abort the import with a
 * {@link StorageException}; nothing is written in that case. Steps 5 and 6 run under a
 * per-account lock.
 */
@Service
public class StatementImportService {

    private static final Logger log = LoggerFactory.getLogger(StatementImportService.class);

    private static final int PNL_SCALE = 4;

    private final StatementCsvReader statementCsvReader;
    private final RecordMapper recordMapper;
    private final FifoReconciler fifoReconciler;
    private final BrokerProfileRegistry brokerProfileRegistry;
    private final TradeRecordStore tradeRecordStore;
    private final AccountImportLocks accountImportLocks;
    private final ApplicationEventPublisher applicationEventPublisher;

    public StatementImportService(
            StatementCsvReader statementCsvReader,
            RecordMapper recordMapper,
            FifoReconciler fifoReconciler,
            BrokerProfileRegistry brokerProfileRegistry,
            TradeRecordStore tradeRecordStore,
            AccountImportLocks accountImportLocks,
            ApplicationEventPublisher applicationEventPublisher) {
        this.statementCsvReader = statementCsvReader;
        this.recordMapper = recordMapper;
        this.fifoReconciler = fifoReconciler;
        this.brokerProfileRegistry = brokerProfileRegistry;
        this.tradeRecordStore = tradeRecordStore;
        this.accountImportLocks = accountImportLocks;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public ImportResult importStatement(ImportCommand command) {
        validate(command);
        String broker = command.getBrokerName().trim();
        String account = command.getAccountName() == null || command.getAccountName().isBlank()
                ? broker
                : command.getAccountName().trim();
        BrokerProfile profile = brokerProfileRegistry.resolve(broker);

        List<RawRecord> records = statementCsvReader.read(command.getStatementText());
        List<MappedRow> rows = recordMapper.mapAll(records);
        if (rows.isEmpty()) {
            log.info("Statement has no rows: owner={}, account={}, broker={}", command.getOwnerId(), account, broker);
            return publish(command.getOwnerId(), ImportResult.emptyStatement(account, broker));
        }

        if (profile.reconcilesFills()) {
            fifoReconciler.reconcile(rows);
        } else {
            rows.stream()
                    .map(MappedRow::getTrade)
                    .filter(trade -> !trade.hasPnl())
                    .forEach(trade -> trade.setPnl(BigDecimal.ZERO));
        }

        List<PartialTrade> trades = applyDateCutoff(rows, command);
        if (trades.isEmpty()) {
            log.info(
                    "All statement rows fall before the cutoff: owner={}, account={}, earliestDate={}",
                    command.getOwnerId(),
                    account,
                    command.getEarliestDate());
            return publish(
                    command.getOwnerId(),
                    ImportResult.builder()
                            .status(ImportStatus.NO_ROWS_MATCH_FILTERS)
                            .account(account)
                            .broker(broker)
                            .parsedRows(rows.size())
                            .message("No rows match the filters provided.")
                            .build());
        }

        applyFeeOverride(trades, command.getFeePerContract());
        trades.forEach(trade -> trade.setPnl(trade.getPnl().setScale(PNL_SCALE, RoundingMode.HALF_UP)));

        ImportResult result = accountImportLocks.withLock(
                command.getOwnerId(), account, () -> dedupAndInsert(command.getOwnerId(), account, broker, rows.size(), trades));
        return publish(command.getOwnerId(), result);
    }

    private ImportResult dedupAndInsert(
            String ownerId, String account, String broker, int parsedRows, List<PartialTrade> trades) {
        List<TradeRecord> existing;
        try {
            existing = tradeRecordStore.findExisting(ownerId, account);
        } catch (StorageException e) {
            throw new StorageException("Unable to check existing trades: " + e.getMessage(), e);
        }

        DedupGate gate = new DedupGate(existing);
        List<TradeRecord> admitted = new ArrayList<>();
        for (PartialTrade trade : trades) {
            if (gate.admit(trade)) {
                admitted.add(toRecord(trade, ownerId, account, broker));
            }
        }

        ImportResult.ImportResultBuilder result = ImportResult.builder()
                .account(account)
                .broker(broker)
                .parsedRows(parsedRows)
                .filteredRows(trades.size())
                .duplicateRows(gate.rejectedCount());
        if (admitted.isEmpty()) {
            log.info("All statement trades already stored: owner={}, account={}, rows={}", ownerId, account, trades.size());
            return result.status(ImportStatus.ALL_DUPLICATES)
                    .message("All trades in this CSV already exist for this account.")
                    .build();
        }

        int inserted;
        try {
            inserted = tradeRecordStore.insertAll(admitted);
        } catch (StorageException e) {
            throw new StorageException("Import failed: " + e.getMessage(), e);
        }
        log.info(
                "Statement imported: owner={}, account={}, broker={}, parsed={}, inserted={}, duplicates={}",
                ownerId,
                account,
                broker,
                parsedRows,
                inserted,
                gate.rejectedCount());
        return result.status(ImportStatus.IMPORTED)
                .insertedCount(inserted)
                .message(String.format("Imported %d trades into %s.", inserted, account))
                .build();
    }

    private static List<PartialTrade> applyDateCutoff(List<MappedRow> rows, ImportCommand command) {
        Instant cutoff = command.getEarliestDate() == null
                ? null
                : command.getEarliestDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        List<PartialTrade> kept = new ArrayList<>(rows.size());
        for (MappedRow row : rows) {
            PartialTrade trade = row.getTrade();
            if (cutoff == null || !trade.hasTimestamp() || !trade.getEntryTimestamp().isBefore(cutoff)) {
                kept.add(trade);
            }
        }
        return kept;
    }

    /**
     * Deducts {@code fee × |quantity|} from futures rows. Commission already charged during
     * reconciliation is not netted out, so both apply when a statement has a commission column.
     */
    private static void applyFeeOverride(List<PartialTrade> trades, BigDecimal feePerContract) {
        if (feePerContract == null || feePerContract.signum() == 0) {
            return;
        }
        for (PartialTrade trade : trades) {
            boolean futures = trade.getType().toLowerCase(Locale.ROOT).contains("future");
            if (futures && trade.hasQuantity() && trade.getQuantity().signum() != 0 && trade.hasPnl()) {
                trade.setPnl(trade.getPnl().subtract(feePerContract.multiply(trade.getQuantity().abs())));
            }
        }
    }

    private static TradeRecord toRecord(PartialTrade trade, String ownerId, String account, String broker) {
        return TradeRecord.builder()
                .ownerId(ownerId)
                .entryTimestamp(trade.getEntryTimestamp())
                .date(trade.getDate())
                .time(trade.getTime())
                .side(trade.getSide())
                .type(trade.getType())
                .ticker(trade.getTicker())
                .quantity(trade.getQuantity())
                .pnl(trade.getPnl())
                .change(trade.getChange())
                .sourceAccount(account)
                .sourceBroker(broker)
                .build();
    }

    private static void validate(ImportCommand command) {
        if (command.getOwnerId() == null || command.getOwnerId().isBlank()) {
            throw new ValidationException("Owner is required");
        }
        if (command.getBrokerName() == null || command.getBrokerName().isBlank()) {
            throw new ValidationException("Broker is required");
        }
        if (command.getFeePerContract() != null && command.getFeePerContract().signum() < 0) {
            throw new ValidationException("Fee per contract must not be negative");
        }
    }

    private ImportResult publish(String ownerId, ImportResult result) {
        applicationEventPublisher.publishEvent(new StatementImportedEvent(this, ownerId, result));
        return result;
    }
}
