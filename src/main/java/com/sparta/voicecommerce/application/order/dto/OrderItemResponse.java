package com.sparta.voicecommerce.application.order.dto;

import com.sparta.voicecommerce.domain.order.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

public record OrderItemResponse(
        @Schema(description = "상품 ID", example = "hoodie-01")
        String productId,

        @Schema(description = "상품명", example = "Black Pullover Hoodie")
        String productName,

        @Schema(description = "옵션 (사이즈)", example = "M", nullable = true)
        String variant,

        @Schema(description = "주문 시점 단가", example = "1800")
        long unitPrice,

        @Schema(description = "수량", example = "1")
        int quantity,

        @Schema(description = "항목 합계", example = "1800")
        long lineTotal
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getProductId(),
                item.getProductName(),
                item.getVariant(),
                item.getUnitPrice(),
                item.getQuantity(),
                item.getLineTotal()
        );
    }
}
