package com.sparta.voicecommerce.domain.order;

import com.sparta.voicecommerce.domain.cart.CartConstants;
import com.sparta.voicecommerce.domain.cart.CartItem;

/**
 * 주문 요청 항목
 * 상품은 이름으로만 지정하며, 가격은 커밋 시점 카탈로그에서 다시 가져온다
 */
public record OrderLineCommand(
        String productName,
        int quantity,
        String variant
) {

    public OrderLineCommand {
        quantity = Math.max(quantity, CartConstants.MIN_QUANTITY);
        variant = CartItem.normalizeVariant(variant);
    }

    public static OrderLineCommand from(CartItem cartItem) {
        return new OrderLineCommand(cartItem.getProductName(), cartItem.getQuantity(), cartItem.getVariant());
    }
}
