package com.sparta.voicecommerce.application.cart.dto;

import com.sparta.voicecommerce.domain.cart.CartConstants;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;

/**
 * 장바구니 상품 추가 요청 DTO
 * 수량이 0 이하이면 1개로 담는다
 */
public record AddToCartRequest(
        @Schema(description = "상품명 (정확히 일치)", example = "Black Pullover Hoodie")
        @NotBlank(message = "상품명은 필수입니다")
        String productName,

        @Schema(description = "수량", example = "1")
        @Max(value = CartConstants.MAX_QUANTITY, message = "수량은 999개 이하여야 합니다")
        int quantity,

        @Schema(description = "옵션 (사이즈)", example = "M", nullable = true)
        String variant
) {
}
