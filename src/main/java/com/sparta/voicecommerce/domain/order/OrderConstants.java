package com.sparta.voicecommerce.domain.order;

/**
 * 주문 도메인 상수
 */
public final class OrderConstants {

    /** 모든 주문에 사용하는 통화 */
    public static final String CURRENCY = "INR";

    /** 주문 ID 접두사 ("order-0001") */
    public static final String ORDER_ID_PREFIX = "order-";

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }

    /**
     * 원장 길이로 다음 주문 ID 생성
     * @param ledgerSize 커밋 시작 시점에 읽은 원장 길이
     */
    public static String nextOrderId(int ledgerSize) {
        return String.format("%s%04d", ORDER_ID_PREFIX, ledgerSize + 1);
    }
}
