package com.sparta.voicecommerce.infrastructure.file.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparta.voicecommerce.domain.order.Order;
import com.sparta.voicecommerce.domain.order.OrderStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 원장 파일의 주문 한 건
 * status는 소문자 코드("confirmed")로 기록한다
 */
public record OrderDocument(
        String id,
        List<OrderItemDocument> items,
        long total,
        String currency,
        @JsonProperty("created_at") LocalDateTime createdAt,
        String status
) {

    public static OrderDocument from(Order order) {
        return new OrderDocument(
                order.getOrderId(),
                order.getItems().stream()
                        .map(OrderItemDocument::from)
                        .toList(),
                order.getTotal(),
                order.getCurrency(),
                order.getCreatedAt(),
                order.getStatus().getCode()
        );
    }

    public Order toDomain() {
        return Order.restore(
                id,
                items == null ? List.of() : items.stream()
                        .map(OrderItemDocument::toDomain)
                        .toList(),
                currency,
                createdAt,
                OrderStatus.from(status)
        );
    }
}
