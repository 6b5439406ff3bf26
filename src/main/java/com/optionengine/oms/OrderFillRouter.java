package com.optionengine.oms;

import com.optionengine.event.OrderFillEvent;
import com.optionengine.event.OrderRejectedEvent;
import com.optionengine.exception.InvalidStateException;
import com.optionengine.exit.ExitController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Routes broker callbacks. Fills of exit orders go to the exit controller; entry fills go
 * to the execution controller and the resulting position is (re)registered for exits.
 */
@Component
public class OrderFillRouter {

    private static final Logger log = LoggerFactory.getLogger(OrderFillRouter.class);

    private final OrderExecutionController orderExecutionController;
    private final ExitController exitController;

    public OrderFillRouter(OrderExecutionController orderExecutionController, ExitController exitController) {
        this.orderExecutionController = orderExecutionController;
        this.exitController = exitController;
    }

    @EventListener
    public void onOrderFilled(OrderFillEvent event) {
        if (exitController.ownsOrder(event.getOrderId())) {
            exitController.onExitOrderFilled(event.getOrderId(), event.getFillPrice());
            return;
        }
        orderExecutionController.onOrderFilled(event).ifPresent(position -> {
            try {
                exitController.registerPosition(position);
            } catch (InvalidStateException e) {
                log.error("Position {} not registered for exits: {}", position.getOrderId(), e.getMessage());
            }
        });
    }

    @EventListener
    public void onOrderRejected(OrderRejectedEvent event) {
        if (exitController.ownsOrder(event.getOrderId())) {
            exitController.onExitOrderRejected(event.getOrderId(), event.getReason());
            return;
        }
        orderExecutionController.onOrderRejected(event.getOrderId(), event.getReason());
    }
}
