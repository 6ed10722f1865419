package com.sparta.voicecommerce.application.order.dto;

import com.sparta.voicecommerce.domain.order.Order;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        @Schema(description = "주문 ID", example = "order-0001")
        String orderId,

        @Schema(description = "주문 항목 목록")
        List<OrderItemResponse> items,

        @Schema(description = "총 금액", example = "2100")
        long total,

        @Schema(description = "통화", example = "INR")
        String currency,

        @Schema(description = "주문 생성 일시", example = "2025-11-28T10:15:30")
        LocalDateTime createdAt,

        @Schema(description = "주문 상태", example = "confirmed")
        String status
) {
    public static OrderResponse from(Order order) {
        List<OrderItemResponse> itemResponses = order.getItems().stream()
                .map(OrderItemResponse::from)
                .toList();

        return new OrderResponse(
                order.getOrderId(),
                itemResponses,
                order.getTotal(),
                order.getCurrency(),
                order.getCreatedAt(),
                order.getStatus().getCode()
        );
    }
}
