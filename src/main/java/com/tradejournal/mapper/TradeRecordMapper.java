package com.tradejournal.mapper;

import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.entity.TradeRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the TradeRecord domain model and TradeRecordEntity.
 * Field names line up one to one.
 */
@Mapper
public interface TradeRecordMapper {

    TradeRecordEntity toEntity(TradeRecord tradeRecord);

    TradeRecord toDomain(TradeRecordEntity entity);

    List<TradeRecordEntity> toEntityList(List<TradeRecord> tradeRecords);

    List<TradeRecord> toDomainList(List<TradeRecordEntity> entities);
}
