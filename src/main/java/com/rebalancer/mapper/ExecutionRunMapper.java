package com.rebalancer.mapper;

import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.entity.ExecutionRunEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ExecutionRunMapper {

    ExecutionRunEntity toEntity(ExecutionRun run);

    ExecutionRun toDomain(ExecutionRunEntity entity);

    List<ExecutionRun> toDomainList(List<ExecutionRunEntity> entities);
}
