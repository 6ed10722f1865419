package com.sparta.voicecommerce.domain.order;

import com.sparta.voicecommerce.domain.product.Product;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 주문 항목
 * lineTotal은 항상 quantity × unitPrice 이다
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {
    private final String productId;
    private final String productName;
    private final int quantity;
    private final long unitPrice;
    private final long lineTotal;
    private final String variant;

    @Builder
    private static OrderItem create(String productId, String productName, int quantity,
                                    long unitPrice, String variant) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("주문 수량은 1개 이상이어야 합니다");
        }
        return new OrderItem(productId, productName, quantity, unitPrice, unitPrice * quantity, variant);
    }

    /**
     * 주문 시점의 카탈로그 상품으로 주문 항목 생성
     */
    public static OrderItem of(Product product, int quantity, String variant) {
        return OrderItem.builder()
                .productId(product.getProductId())
                .productName(product.getName())
                .quantity(quantity)
                .unitPrice(product.getPrice())
                .variant(variant)
                .build();
    }

    public boolean hasVariant() {
        return variant != null;
    }
}
