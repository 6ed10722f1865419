package com.sparta.voicecommerce.domain.product.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;

/**
 * 상품명을 카탈로그에서 찾을 수 없을 때 발생하는 예외
 */
public class ProductNotFoundException extends BusinessException {

    private final String productName;

    public ProductNotFoundException(String productName) {
        super(ErrorCode.P001, "상품을 찾을 수 없습니다: " + productName);
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }
}
