package com.sparta.voicecommerce.application.cart.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 장바구니 상품 추가 결과
 */
public record AddToCartResponse(
        @Schema(description = "추가/갱신된 장바구니 항목")
        CartItemResponse item,

        @Schema(description = "이번에 추가된 수량 (보정 후)", example = "1")
        int addedQuantity,

        @Schema(description = "추가 후 장바구니 전체")
        CartResponse cart
) {
}
