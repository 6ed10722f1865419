package com.sparta.voicecommerce.domain.cart.exception;

import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.common.exception.ErrorCode;

/**
 * 주문할 항목이 없을 때 발생하는 예외
 */
public class EmptyCartException extends BusinessException {
    public EmptyCartException(String message) {
        super(ErrorCode.CART002, message);
    }
}
