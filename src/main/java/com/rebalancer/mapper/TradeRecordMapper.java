package com.rebalancer.mapper;

import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.entity.TradeRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TradeRecordMapper {

    TradeRecordEntity toEntity(TradeRecord trade);

    TradeRecord toDomain(TradeRecordEntity entity);

    List<TradeRecord> toDomainList(List<TradeRecordEntity> entities);
}
