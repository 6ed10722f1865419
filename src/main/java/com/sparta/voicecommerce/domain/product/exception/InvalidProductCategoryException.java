package com.sparta.voicecommerce.domain.product.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;

/**
 * 알 수 없는 카테고리 값이 들어왔을 때 발생하는 예외
 */
public class InvalidProductCategoryException extends BusinessException {

    private final String category;

    public InvalidProductCategoryException(String category) {
        super(ErrorCode.P002, "존재하지 않는 상품 카테고리입니다: " + category);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
