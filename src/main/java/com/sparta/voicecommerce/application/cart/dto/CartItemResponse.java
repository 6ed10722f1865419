package com.sparta.voicecommerce.application.cart.dto;

import com.sparta.voicecommerce.domain.cart.CartItem;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 장바구니 항목 응답 DTO
 */
public record CartItemResponse(
        @Schema(description = "상품 ID", example = "hoodie-01")
        String productId,

        @Schema(description = "상품명", example = "Black Pullover Hoodie")
        String productName,

        @Schema(description = "옵션 (사이즈)", example = "M", nullable = true)
        String variant,

        @Schema(description = "담은 시점 단가", example = "1800")
        long unitPrice,

        @Schema(description = "수량", example = "2")
        int quantity,

        @Schema(description = "소계", example = "3600")
        long subtotal
) {
    public static CartItemResponse from(CartItem cartItem) {
        return new CartItemResponse(
                cartItem.getProductId(),
                cartItem.getProductName(),
                cartItem.getVariant(),
                cartItem.getUnitPrice(),
                cartItem.getQuantity(),
                cartItem.getSubtotal()
        );
    }
}
