package com.sparta.voicecommerce.common.exception;

/**
 * 에러 코드 정의
 * 대화 드라이버와 REST 응답이 같은 코드를 사용한다
 */
public enum ErrorCode {
    // 상품/카탈로그 관련 에러
    P001("P001", "상품을 찾을 수 없습니다", 404),
    P002("P002", "존재하지 않는 상품 카테고리입니다", 400),
    P003("P003", "상품 카탈로그를 불러올 수 없습니다", 503),

    // 장바구니 관련 에러
    CART001("CART001", "장바구니 항목을 찾을 수 없습니다", 404),
    CART002("CART002", "주문할 장바구니 항목이 없습니다", 400),
    CART003("CART003", "장바구니 항목 수량 한도를 초과했습니다", 400),

    // 주문 관련 에러
    O001("O001", "주문을 찾을 수 없습니다", 404),

    // 저장소 관련 에러
    SYS001("SYS001", "주문 원장 저장에 실패했습니다", 500),

    // 공통 에러
    COMMON001("COMMON001", "필수 파라미터가 누락되었습니다", 400),
    COMMON002("COMMON002", "잘못된 요청 형식입니다", 400),
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int status;

    ErrorCode(String code, String message, int status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatus() {
        return status;
    }
}
