package com.tradejournal.service;

import com.tradejournal.config.ImportConfig;
import org.springframework.stereotype.Component;

/**
 * Picks the owner id a request acts for: the {@code X-Owner-Id} header when present, otherwise
 * the configured default owner.
 */
@Component
public class OwnerResolver {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final ImportConfig importConfig;

    public OwnerResolver(ImportConfig importConfig) {
        this.importConfig = importConfig;
    }

    public String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return importConfig.getDefaultOwner();
        }
        return headerValue.trim();
    }
}
