package com.sparta.voicecommerce.domain.cart.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외
 * 옵션(사이즈)이 일치하지 않는 경우도 포함한다
 */
public class CartItemNotFoundException extends BusinessException {

    private final String productName;
    private final String variant;

    public CartItemNotFoundException(String productName, String variant) {
        super(ErrorCode.CART001, variant == null || variant.isBlank()
                ? "장바구니 항목을 찾을 수 없습니다: " + productName
                : "장바구니 항목을 찾을 수 없습니다: " + productName + " (옵션: " + variant + ")");
        this.productName = productName;
        this.variant = variant;
    }

    public String getProductName() {
        return productName;
    }

    public String getVariant() {
        return variant;
    }
}
