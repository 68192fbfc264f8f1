package com.tradejournal.repository;

import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.exception.StorageException;
import java.util.List;

/**
 * Persistence boundary for imported trades. Every call is scoped to one owner.
 *
 * <p>Implementations report failures as {@link StorageException} carrying the underlying message.
 */
public interface TradeRecordStore {

    /** All stored trades of {@code ownerId} under {@code account}. */
    List<TradeRecord> findExisting(String ownerId, String account);

    /**
     * Stores all records or none.
     *
     * @return the number of records written
     */
    int insertAll(List<TradeRecord> records);

    /** @return the number of records removed; zero when the account had none */
    int deleteByAccount(String ownerId, String account);

    /** All stored trades of {@code ownerId}, newest entry first. */
    List<TradeRecord> findByOwner(String ownerId);
}
