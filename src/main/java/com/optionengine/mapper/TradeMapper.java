package com.optionengine.mapper;

import com.optionengine.domain.model.TradeRecord;
import com.optionengine.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between TradeRecord and TradeEntity. The trading date column is derived
 * from the execution time so reports can query a day without a range scan.
 */
@Mapper
public interface TradeMapper {

    @Mapping(
            target = "tradingDate",
            expression = "java(tradeRecord.getExecutedAt() != null ? tradeRecord.getExecutedAt().toLocalDate() : null)")
    TradeEntity toEntity(TradeRecord tradeRecord);

    TradeRecord toDomain(TradeEntity entity);

    List<TradeRecord> toDomainList(List<TradeEntity> entities);
}
