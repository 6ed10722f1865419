package com.sparta.voicecommerce.application.cart.dto;

import com.sparta.voicecommerce.domain.cart.Cart;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 장바구니 응답 DTO
 */
public record CartResponse(
        @Schema(description = "세션 ID", example = "room-42")
        String sessionId,

        @Schema(description = "장바구니 항목 목록 (담은 순서)")
        List<CartItemResponse> items,

        @Schema(description = "총 상품 개수", example = "3")
        int totalItemCount,

        @Schema(description = "총 금액 (담은 시점 가격 기준)", example = "4400")
        long totalAmount
) {
    public static CartResponse of(String sessionId, Cart cart) {
        List<CartItemResponse> items = cart.getItems().stream()
                .map(CartItemResponse::from)
                .toList();
        return new CartResponse(sessionId, items, cart.getTotalItemCount(), cart.getTotalAmount());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int lineCount() {
        return items.size();
    }
}
