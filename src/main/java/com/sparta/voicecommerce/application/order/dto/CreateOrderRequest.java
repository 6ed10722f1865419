package com.sparta.voicecommerce.application.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;

import java.util.List;

/**
 * 주문 항목을 직접 지정하는 주문 생성 요청
 * 세션 장바구니를 거치지 않는다
 */
public record CreateOrderRequest(
        @Schema(description = "주문 항목 목록")
        List<@Valid OrderLineRequest> items
) {
    public CreateOrderRequest {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
