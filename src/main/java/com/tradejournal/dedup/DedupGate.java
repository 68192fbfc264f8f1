package com.tradejournal.dedup;

import com.tradejournal.domain.model.PartialTrade;
import com.tradejournal.domain.model.TradeRecord;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Admits each trade at most once per account.
 *
 * <p>Seeded with the keys of the trades already stored for the account; every admitted trade's
 * key is added, so a repeat later in the same batch is rejected too. One gate serves one import.
 */
public class DedupGate {

    private final Set<String> seen = new HashSet<>();
    private int rejected;

    public DedupGate(Collection<TradeRecord> existing) {
        for (TradeRecord record : existing) {
            seen.add(TradeKey.of(record));
        }
    }

    /**
     * @return true when the trade's key was new and has now been recorded
     */
    public boolean admit(PartialTrade trade) {
        if (seen.add(TradeKey.of(trade))) {
            return true;
        }
        rejected++;
        return false;
    }

    public int rejectedCount() {
        return rejected;
    }
}
