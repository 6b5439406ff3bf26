package com.optionengine.mapper;

import com.optionengine.domain.model.DailySummary;
import com.optionengine.entity.DailySummaryEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface DailySummaryMapper {

    @Mapping(target = "id", ignore = true)
    DailySummaryEntity toEntity(DailySummary summary);

    DailySummary toDomain(DailySummaryEntity entity);
}
