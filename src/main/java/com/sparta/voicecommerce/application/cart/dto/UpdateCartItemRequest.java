package com.sparta.voicecommerce.application.cart.dto;

import com.sparta.voicecommerce.domain.cart.CartConstants;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;

/**
 * 장바구니 수량 변경 요청 DTO
 */
public record UpdateCartItemRequest(
        @Schema(description = "상품명", example = "Black Pullover Hoodie")
        @NotBlank(message = "상품명은 필수입니다")
        String productName,

        @Schema(description = "옵션 (사이즈)", example = "M", nullable = true)
        String variant,

        @Schema(description = "변경할 수량 (0 이하면 삭제)", example = "3")
        @Max(value = CartConstants.MAX_QUANTITY, message = "수량은 999개 이하여야 합니다")
        int quantity
) {
}
