package com.optionengine.domain.model;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Input to {@link com.optionengine.broker.Broker#placeOrder(OrderRequest)}.
 *
 * <p>The client order id is generated by the caller before submission so that a fill
 * callback racing the placement call can still be correlated with its position.
 */
@Value
@Builder
public class OrderRequest {

    String clientOrderId;
    Contract contract;
    OrderSide side;
    OrderType type;
    int quantity;
    BigDecimal price;
    BigDecimal triggerPrice;
}
