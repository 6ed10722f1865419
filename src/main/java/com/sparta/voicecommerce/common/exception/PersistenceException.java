package com.sparta.voicecommerce.common.exception;

/**
 * 주문 원장 파일 읽기/쓰기 실패 시 발생하는 예외
 */
public class PersistenceException extends BusinessException {
    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.SYS001, message, cause);
    }
}
