package com.sparta.voicecommerce.domain.order;

import java.util.Arrays;

/**
 * 주문 상태
 * 현재는 확정(confirmed) 상태만 존재한다
 */
public enum OrderStatus {

    CONFIRMED("confirmed");

    private final String code;

    OrderStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static OrderStatus from(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 주문 상태입니다: " + code));
    }
}
