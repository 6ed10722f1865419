package com.sparta.voicecommerce.domain.cart.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;
import com.sparta.voicecommerce.domain.cart.CartConstants;

/**
 * 장바구니 항목 수량이 최대 수량을 넘을 때 발생하는 예외
 * 이 예외가 발생하면 장바구니는 변경되지 않는다
 */
public class CartQuantityExceededException extends BusinessException {

    private final String productName;
    private final long requestedQuantity;

    public CartQuantityExceededException(String productName, long requestedQuantity) {
        super(ErrorCode.CART003, String.format("장바구니 항목 수량 한도를 초과했습니다: %s (요청: %d, 최대: %d)",
                productName, requestedQuantity, CartConstants.MAX_QUANTITY));
        this.productName = productName;
        this.requestedQuantity = requestedQuantity;
    }

    public String getProductName() {
        return productName;
    }

    public long getRequestedQuantity() {
        return requestedQuantity;
    }

    public int getMaxQuantity() {
        return CartConstants.MAX_QUANTITY;
    }
}
