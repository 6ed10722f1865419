package com.sparta.voicecommerce.domain.cart;

import com.sparta.voicecommerce.domain.cart.exception.CartQuantityExceededException;
import com.sparta.voicecommerce.domain.product.Product;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * 장바구니 항목 (불변)
 * 상품명과 단가는 담는 시점의 스냅샷이며, 주문 시에는 카탈로그 가격으로 다시 계산된다
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CartItem {
    private final String productId;
    private final String productName;
    private final int quantity;
    private final long unitPrice;
    private final String variant;

    /**
     * 상품 스냅샷으로 장바구니 항목 생성
     */
    public static CartItem of(Product product, int quantity, String variant) {
        if (quantity < CartConstants.MIN_QUANTITY) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        if (quantity > CartConstants.MAX_QUANTITY) {
            throw new CartQuantityExceededException(product.getName(), quantity);
        }
        return CartItem.builder()
                .productId(product.getProductId())
                .productName(product.getName())
                .quantity(quantity)
                .unitPrice(product.getPrice())
                .variant(normalizeVariant(variant))
                .build();
    }

    /**
     * 수량 증가
     * @throws CartQuantityExceededException 합산 수량이 최대 수량을 넘는 경우
     */
    public CartItem addQuantity(int additionalQuantity) {
        if (additionalQuantity <= 0) {
            throw new IllegalArgumentException("추가 수량은 1개 이상이어야 합니다");
        }
        if (additionalQuantity > CartConstants.MAX_QUANTITY - this.quantity) {
            throw new CartQuantityExceededException(productName, (long) this.quantity + additionalQuantity);
        }
        return toBuilder()
                .quantity(this.quantity + additionalQuantity)
                .build();
    }

    /**
     * 수량 변경
     */
    public CartItem updateQuantity(int newQuantity) {
        if (newQuantity < CartConstants.MIN_QUANTITY) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        if (newQuantity > CartConstants.MAX_QUANTITY) {
            throw new CartQuantityExceededException(productName, newQuantity);
        }
        return toBuilder()
                .quantity(newQuantity)
                .build();
    }

    /**
     * 같은 슬롯(상품 ID + 옵션)인지 확인
     */
    public boolean isSameSlot(String otherProductId, String otherVariant) {
        return productId.equals(otherProductId)
                && Objects.equals(variant, normalizeVariant(otherVariant));
    }

    /**
     * 상품명과 옵션이 정확히 일치하는지 확인 (삭제/수량 변경 대상 탐색용)
     */
    public boolean matches(String otherProductName, String otherVariant) {
        return productName.equals(otherProductName)
                && Objects.equals(variant, normalizeVariant(otherVariant));
    }

    public boolean hasVariant() {
        return variant != null;
    }

    public long getSubtotal() {
        return unitPrice * quantity;
    }

    /**
     * 빈 옵션 값은 "옵션 없음"으로 본다
     */
    public static String normalizeVariant(String variant) {
        return (variant == null || variant.isBlank()) ? null : variant;
    }
}
