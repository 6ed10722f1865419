package com.sparta.voicecommerce.domain.order;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 주문 원장 인터페이스
 * 확정된 주문을 추가만 가능한 순서 있는 목록으로 보관한다
 */
public interface OrderLedger {

    /**
     * 원장 전체를 기록된 순서대로 조회
     */
    List<Order> findAll();

    /**
     * 가장 최근 주문 조회
     */
    Optional<Order> findLast();

    /**
     * 주문 ID로 조회
     */
    Optional<Order> findById(String orderId);

    /**
     * 원장 읽기 → 주문 생성 → 추가 → 전체 저장을 하나의 임계 구역에서 수행한다.
     * orderCreator는 현재 원장 전체를 받아 새 주문을 만든다. 예외를 던지면 아무것도 저장하지 않는다.
     *
     * @return 저장된 주문
     * @throws com.sparta.voicecommerce.common.exception.PersistenceException 원장 읽기/쓰기 실패
     */
    Order append(Function<List<Order>, Order> orderCreator);
}
