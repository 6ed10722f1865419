package com.sparta.voicecommerce.domain.order;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 확정된 주문
 * total은 생성 시 항목들의 lineTotal 합으로 계산되며 따로 지정할 수 없다
 */
@Getter
public class Order {

    private final String orderId;
    private final List<OrderItem> items;
    private final long total;
    private final String currency;
    private final LocalDateTime createdAt;
    private final OrderStatus status;

    private Order(String orderId, List<OrderItem> items, String currency,
                  LocalDateTime createdAt, OrderStatus status) {
        this.orderId = orderId;
        this.items = List.copyOf(items);
        this.total = this.items.stream()
                .mapToLong(OrderItem::getLineTotal)
                .sum();
        this.currency = currency;
        this.createdAt = createdAt;
        this.status = status;
    }

    /**
     * 새 주문 확정
     */
    public static Order confirm(String orderId, List<OrderItem> items, LocalDateTime createdAt) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 1개 이상이어야 합니다");
        }
        return new Order(orderId, items, OrderConstants.CURRENCY, createdAt, OrderStatus.CONFIRMED);
    }

    /**
     * 저장소에 기록된 주문 복원
     */
    public static Order restore(String orderId, List<OrderItem> items, String currency,
                                LocalDateTime createdAt, OrderStatus status) {
        return new Order(orderId, items, currency, createdAt, status);
    }

    public int getItemCount() {
        return items.size();
    }
}
