package com.tradejournal.service;

import com.tradejournal.domain.model.ImportSource;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.exception.StorageException;
import com.tradejournal.repository.TradeRecordStore;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lists the (account, broker) pairs an owner has imported into, and removes an account's trades.
 */
@Service
public class ImportSourceService {

    private static final Logger log = LoggerFactory.getLogger(ImportSourceService.class);

    static final String SOURCE_TYPE = "Statement";
    static final String UNKNOWN_BROKER = "Unknown";

    private final TradeRecordStore tradeRecordStore;

    public ImportSourceService(TradeRecordStore tradeRecordStore) {
        this.tradeRecordStore = tradeRecordStore;
    }

    /**
     * Groups the owner's trades by account and broker. Sources are ordered by their latest entry
     * timestamp, newest first; sources with no timestamped trade come last.
     */
    public List<ImportSource> listSources(String ownerId) {
        Map<String, SourceAccumulator> grouped = new LinkedHashMap<>();
        for (TradeRecord record : tradeRecordStore.findByOwner(ownerId)) {
            String account = record.getSourceAccount();
            if (account == null || account.isBlank()) {
                continue;
            }
            String broker = record.getSourceBroker() == null || record.getSourceBroker().isBlank()
                    ? UNKNOWN_BROKER
                    : record.getSourceBroker();
            grouped.computeIfAbsent(account + "::" + broker, key -> new SourceAccumulator(account, broker))
                    .add(record.getEntryTimestamp());
        }
        return grouped.entrySet().stream()
                .map(entry -> entry.getValue().toSource(entry.getKey()))
                .sorted(Comparator.comparing(
                        ImportSource::getLastUpdated, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Deletes every trade of {@code account}. Deleting an account with no trades returns zero.
     */
    public int deleteSource(String ownerId, String account) {
        int deleted;
        try {
            deleted = tradeRecordStore.deleteByAccount(ownerId, account);
        } catch (StorageException e) {
            throw new StorageException("Unable to delete trades: " + e.getMessage(), e);
        }
        log.info("Import source deleted: owner={}, account={}, trades={}", ownerId, account, deleted);
        return deleted;
    }

    private static final class SourceAccumulator {

        private final String account;
        private final String broker;
        private Instant latest;
        private long count;

        SourceAccumulator(String account, String broker) {
            this.account = account;
            this.broker = broker;
        }

        void add(Instant entryTimestamp) {
            count++;
            if (entryTimestamp != null && (latest == null || entryTimestamp.isAfter(latest))) {
                latest = entryTimestamp;
            }
        }

        ImportSource toSource(String key) {
            return ImportSource.builder()
                    .key(key)
                    .accountId(account)
                    .broker(broker)
                    .type(SOURCE_TYPE)
                    .details("Broker: " + broker)
                    .lastUpdated(latest)
                    .tradeCount(count)
                    .build();
        }
    }
}
