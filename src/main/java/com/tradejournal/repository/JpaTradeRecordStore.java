package com.tradejournal.repository;

import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.entity.TradeRecordEntity;
import com.tradejournal.exception.StorageException;
import com.tradejournal.mapper.TradeRecordMapper;
import com.tradejournal.repository.jpa.TradeRecordJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;

/**
 * {@link TradeRecordStore} backed by the trade_records table.
 *
 * <p>Inserts go through a single {@code saveAllAndFlush}, which runs in one transaction, so a
 * failing row rolls back the whole batch.
 */
@Repository
public class JpaTradeRecordStore implements TradeRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTradeRecordStore.class);

    private final TradeRecordJpaRepository tradeRecordJpaRepository;
    private final TradeRecordMapper tradeRecordMapper;

    public JpaTradeRecordStore(
            TradeRecordJpaRepository tradeRecordJpaRepository, TradeRecordMapper tradeRecordMapper) {
        this.tradeRecordJpaRepository = tradeRecordJpaRepository;
        this.tradeRecordMapper = tradeRecordMapper;
    }

    @Override
    public List<TradeRecord> findExisting(String ownerId, String account) {
        try {
            return tradeRecordMapper.toDomainList(
                    tradeRecordJpaRepository.findByOwnerIdAndSourceAccount(ownerId, account));
        } catch (DataAccessException e) {
            throw new StorageException(e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public int insertAll(List<TradeRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now();
        List<TradeRecordEntity> entities = tradeRecordMapper.toEntityList(records);
        for (TradeRecordEntity entity : entities) {
            if (entity.getId() == null) {
                entity.setId(UUID.randomUUID().toString());
            }
            entity.setCreatedAt(now);
        }
        try {
            int saved = tradeRecordJpaRepository.saveAllAndFlush(entities).size();
            log.debug("Inserted trade records: count={}", saved);
            return saved;
        } catch (DataAccessException e) {
            throw new StorageException(e.getMostSpecificCause().getMessage(), e);
        } catch (TransactionException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public int deleteByAccount(String ownerId, String account) {
        try {
            return tradeRecordJpaRepository.deleteByOwnerIdAndSourceAccount(ownerId, account);
        } catch (DataAccessException e) {
            throw new StorageException(e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public List<TradeRecord> findByOwner(String ownerId) {
        try {
            return tradeRecordMapper.toDomainList(tradeRecordJpaRepository.findByOwnerIdOrderByEntryTimestampDesc(ownerId));
        } catch (DataAccessException e) {
            throw new StorageException(e.getMostSpecificCause().getMessage(), e);
        }
    }
}
