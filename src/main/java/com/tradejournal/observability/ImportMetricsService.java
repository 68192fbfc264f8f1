package com.tradejournal.observability;

import com.tradejournal.domain.enums.ImportStatus;
import com.tradejournal.event.StatementImportedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for statement imports:
 * <ul>
 *   <li><b>imports.completed</b> (counter, tag {@code status}): one per import, by outcome</li>
 *   <li><b>imports.trades.inserted</b> (counter): trades written</li>
 *   <li><b>imports.trades.duplicate</b> (counter): rows dropped as already stored</li>
 * </ul>
 */
@Service
public class ImportMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ImportMetricsService.class);

    private final Map<ImportStatus, Counter> completedByStatus = new EnumMap<>(ImportStatus.class);
    private final Counter tradesInsertedCounter;
    private final Counter duplicateRowsCounter;

    public ImportMetricsService(MeterRegistry meterRegistry) {
        for (ImportStatus status : ImportStatus.values()) {
            completedByStatus.put(
                    status,
                    Counter.builder("imports.completed")
                            .description("Statement imports by outcome")
                            .tag("status", status.name())
                            .register(meterRegistry));
        }
        this.tradesInsertedCounter = Counter.builder("imports.trades.inserted")
                .description("Trades written by statement imports")
                .register(meterRegistry);
        this.duplicateRowsCounter = Counter.builder("imports.trades.duplicate")
                .description("Statement rows skipped because the trade was already stored")
                .register(meterRegistry);
    }

    @EventListener
    public void onStatementImported(StatementImportedEvent event) {
        var result = event.getResult();
        completedByStatus.get(result.getStatus()).increment();
        tradesInsertedCounter.increment(result.getInsertedCount());
        duplicateRowsCounter.increment(result.getDuplicateRows());
        log.debug(
                "Import metrics updated: status={}, inserted={}, duplicates={}",
                result.getStatus(),
                result.getInsertedCount(),
                result.getDuplicateRows());
    }
}
