package com.optionengine.mapper;

import com.optionengine.domain.model.Order;
import com.optionengine.entity.OrderEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** Flattens the order's contract into the orders table row. Write-only. */
@Mapper
public interface OrderMapper {

    @Mapping(source = "contract.symbol", target = "symbol")
    @Mapping(source = "contract.instrumentToken", target = "instrumentToken")
    OrderEntity toEntity(Order order);
}
