package com.rebalancer.mapper;

import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.entity.OwnershipEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper between OwnershipRecord and OwnershipEntity. */
@Mapper
public interface OwnershipMapper {

    @Mapping(target = "id", expression = "java(ownershipId(record.getPortfolioName(), record.getSymbol()))")
    OwnershipEntity toEntity(OwnershipRecord record);

    OwnershipRecord toDomain(OwnershipEntity entity);

    List<OwnershipRecord> toDomainList(List<OwnershipEntity> entities);

    /** Row id of a (portfolio, symbol) pair. */
    default String ownershipId(String portfolioName, String symbol) {
        return portfolioName + "_" + symbol;
    }
}
