package com.tradejournal.event;

import com.tradejournal.domain.model.ImportResult;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed statement import, including imports that inserted nothing.
 *
 * <p>Not published when the import failed with a storage error.
 */
public class StatementImportedEvent extends ApplicationEvent {

    private final String ownerId;
    private final ImportResult result;
    private final LocalDateTime importedAt;

    public StatementImportedEvent(Object source, String ownerId, ImportResult result) {
        super(source);
        this.ownerId = ownerId;
        this.result = result;
        this.importedAt = LocalDateTime.now();
    }

    public String getOwnerId() {
        return ownerId;
    }

    public ImportResult getResult() {
        return result;
    }

    public LocalDateTime getImportedAt() {
        return importedAt;
    }
}
