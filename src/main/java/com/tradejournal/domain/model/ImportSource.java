package com.tradejournal.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** An (account, broker) pair the owner has imported statements into. */
@Getter
@Builder
public class ImportSource {

    private final String key;
    private final String accountId;
    private final String broker;
    private final String type;
    private final String details;

    /** Latest entry timestamp among the source's trades; null when none are timestamped. */
    private final Instant lastUpdated;

    private final long tradeCount;
}
