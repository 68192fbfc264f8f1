package com.tradejournal.repository.jpa;

import com.tradejournal.entity.TradeRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the trade_records table.
 */
@Repository
public interface TradeRecordJpaRepository extends JpaRepository<TradeRecordEntity, String> {

    List<TradeRecordEntity> findByOwnerIdAndSourceAccount(String ownerId, String sourceAccount);

    List<TradeRecordEntity> findByOwnerIdOrderByEntryTimestampDesc(String ownerId);

    @Modifying
    @Transactional
    @Query("DELETE FROM TradeRecordEntity t WHERE t.ownerId = :ownerId AND t.sourceAccount = :sourceAccount")
    int deleteByOwnerIdAndSourceAccount(
            @Param("ownerId") String ownerId, @Param("sourceAccount") String sourceAccount);
}
