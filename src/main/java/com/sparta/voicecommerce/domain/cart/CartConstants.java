package com.sparta.voicecommerce.domain.cart;

/**
 * 장바구니 도메인 상수
 */
public final class CartConstants {

    /** 장바구니 항목 최소 수량. 이보다 작은 추가 요청은 이 값으로 보정한다 */
    public static final int MIN_QUANTITY = 1;

    /** 장바구니 항목 최대 수량. 합산 결과가 이 값을 넘으면 담지 않는다 */
    public static final int MAX_QUANTITY = 999;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
