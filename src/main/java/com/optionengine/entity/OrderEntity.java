package com.optionengine.entity;

import com.optionengine.domain.enums.OrderSide;
import com.optionengine.domain.enums.OrderStatus;
import com.optionengine.domain.enums.OrderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the orders table. Keyed by the client order id. */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50)
    private String symbol;

    @Column(name = "instrument_token")
    private long instrumentToken;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderType type;

    private int quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "trigger_price", precision = 15, scale = 2)
    private BigDecimal triggerPrice;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderStatus status;

    @Column(name = "filled_quantity")
    private int filledQuantity;

    @Column(name = "average_fill_price", precision = 15, scale = 6)
    private BigDecimal averageFillPrice;

    @Column(name = "rejection_reason", length = 500)
    private String rejectionReason;

    @Column(name = "placed_at")
    private LocalDateTime placedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
