package com.optionengine.mapper;

import com.optionengine.domain.model.AggregatePosition;
import com.optionengine.domain.model.Contract;
import com.optionengine.entity.PositionEntity;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between AggregatePosition and PositionEntity.
 *
 * <p>The entity flattens the contract into symbol/exchange/token/lot columns and stores the
 * contributing order ids as one comma-separated column.
 */
@Mapper
public interface PositionMapper {

    @Mapping(source = "contract.symbol", target = "symbol")
    @Mapping(source = "contract.exchange", target = "exchange")
    @Mapping(source = "contract.instrumentToken", target = "instrumentToken")
    @Mapping(source = "contract.lotSize", target = "lotSize")
    @Mapping(source = "orderIds", target = "orderIds", qualifiedByName = "joinOrderIds")
    PositionEntity toEntity(AggregatePosition position);

    @Mapping(target = "contract", expression = "java(toContract(entity))")
    @Mapping(source = "orderIds", target = "orderIds", qualifiedByName = "splitOrderIds")
    AggregatePosition toDomain(PositionEntity entity);

    default Contract toContract(PositionEntity entity) {
        return Contract.builder()
                .symbol(entity.getSymbol())
                .exchange(entity.getExchange())
                .instrumentToken(entity.getInstrumentToken())
                .lotSize(entity.getLotSize())
                .build();
    }

    @Named("joinOrderIds")
    default String joinOrderIds(List<String> orderIds) {
        return orderIds == null ? null : String.join(",", orderIds);
    }

    @Named("splitOrderIds")
    default List<String> splitOrderIds(String orderIds) {
        if (orderIds == null || orderIds.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(orderIds.split(",")));
    }
}
