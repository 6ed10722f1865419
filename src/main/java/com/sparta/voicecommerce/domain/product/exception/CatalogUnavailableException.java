package com.sparta.voicecommerce.domain.product.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;

/**
 * 상품 카탈로그를 불러올 수 없을 때 발생하는 예외
 * 치명적이지 않으며, 호출자는 "상품 0개"로 취급한다
 */
public class CatalogUnavailableException extends BusinessException {

    public CatalogUnavailableException(String message) {
        super(ErrorCode.P003, message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(ErrorCode.P003, message, cause);
    }
}
