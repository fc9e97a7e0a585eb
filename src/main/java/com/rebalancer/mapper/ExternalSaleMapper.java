package com.rebalancer.mapper;

import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.entity.ExternalSaleEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ExternalSaleMapper {

    ExternalSaleEntity toEntity(ExternalSaleRecord sale);

    ExternalSaleRecord toDomain(ExternalSaleEntity entity);

    List<ExternalSaleRecord> toDomainList(List<ExternalSaleEntity> entities);
}
