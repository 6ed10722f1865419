package com.sparta.voicecommerce.infrastructure.file.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparta.voicecommerce.domain.order.OrderItem;

/**
 * 원장 파일의 주문 항목 한 건
 * 옵션이 없는 항목은 size 필드를 쓰지 않는다
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderItemDocument(
        @JsonProperty("product_id") String productId,
        @JsonProperty("product_name") String productName,
        int quantity,
        long price,
        @JsonProperty("item_total") long itemTotal,
        String size
) {

    public static OrderItemDocument from(OrderItem item) {
        return new OrderItemDocument(
                item.getProductId(),
                item.getProductName(),
                item.getQuantity(),
                item.getUnitPrice(),
                item.getLineTotal(),
                item.getVariant()
        );
    }

    public OrderItem toDomain() {
        return OrderItem.builder()
                .productId(productId)
                .productName(productName)
                .quantity(quantity)
                .unitPrice(price)
                .variant(size)
                .build();
    }
}
