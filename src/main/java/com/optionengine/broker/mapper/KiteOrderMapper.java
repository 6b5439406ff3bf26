package com.optionengine.broker.mapper;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import com.optionengine.domain.model.OrderRequest;
import com.zerodhatech.kiteconnect.utils.Constants;
import com.zerodhatech.models.OrderParams;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Conversions between engine order types and the Kite SDK's public-field models.
 *
 * <p>Kite reports quantities and prices as strings; unparseable values read as zero.
 */
@Component
public class KiteOrderMapper {

    /**
     * Intraday (MIS) order parameters. The client order id is sent as the tag so that
     * WebSocket updates can be correlated back to it.
     */
    public OrderParams toOrderParams(OrderRequest request) {
        OrderParams params = new OrderParams();
        params.tradingsymbol = request.getContract().getSymbol();
        params.exchange = request.getContract().getExchange() != null
                ? request.getContract().getExchange()
                : Constants.EXCHANGE_NFO;
        params.transactionType =
                request.getSide() == OrderSide.BUY ? Constants.TRANSACTION_TYPE_BUY : Constants.TRANSACTION_TYPE_SELL;
        params.orderType = mapToKiteOrderType(request.getType());
        params.quantity = request.getQuantity();
        params.product = Constants.PRODUCT_MIS;
        params.validity = Constants.VALIDITY_DAY;
        params.tag = request.getClientOrderId();

        if (request.getType() == OrderType.LIMIT && request.getPrice() != null) {
            params.price = request.getPrice().doubleValue();
        }
        if (request.getType() == OrderType.STOP) {
            BigDecimal trigger = request.getTriggerPrice() != null ? request.getTriggerPrice() : request.getPrice();
            if (trigger != null) {
                params.triggerPrice = trigger.doubleValue();
            }
        }
        return params;
    }

    /**
     * Maps a Kite status string plus the cumulative filled quantity to an engine status.
     * Working orders with some quantity filled read as PARTIAL.
     */
    public OrderStatus mapStatus(String kiteStatus, int filledQuantity) {
        if (kiteStatus == null) {
            return filledQuantity > 0 ? OrderStatus.PARTIAL : OrderStatus.PENDING;
        }
        return switch (kiteStatus) {
            case "COMPLETE" -> OrderStatus.FILLED;
            case "CANCELLED" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            default -> filledQuantity > 0 ? OrderStatus.PARTIAL : OrderStatus.PENDING;
        };
    }

    String mapToKiteOrderType(OrderType type) {
        if (type == null) {
            return Constants.ORDER_TYPE_MARKET;
        }
        return switch (type) {
            case MARKET -> Constants.ORDER_TYPE_MARKET;
            case LIMIT -> Constants.ORDER_TYPE_LIMIT;
            case STOP -> Constants.ORDER_TYPE_SLM;
        };
    }

    // ---- Parsing helpers ----

    public int parseInt(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public BigDecimal parseBigDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
