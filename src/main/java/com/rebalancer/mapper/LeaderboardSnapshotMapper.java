package com.rebalancer.mapper;

import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.entity.LeaderboardSnapshotEntity;
import java.util.Arrays;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between LeaderboardSnapshot and LeaderboardSnapshotEntity.
 * The ordered symbol list is flattened into a single comma-separated column.
 */
@Mapper
public interface LeaderboardSnapshotMapper {

    @Mapping(target = "id", ignore = true)
    LeaderboardSnapshotEntity toEntity(LeaderboardSnapshot snapshot);

    LeaderboardSnapshot toDomain(LeaderboardSnapshotEntity entity);

    default String joinSymbols(List<String> symbols) {
        return symbols == null ? "" : String.join(",", symbols);
    }

    default List<String> splitSymbols(String symbols) {
        if (symbols == null || symbols.isBlank()) {
            return List.of();
        }
        return Arrays.stream(symbols.split(",")).map(String::trim).toList();
    }
}
