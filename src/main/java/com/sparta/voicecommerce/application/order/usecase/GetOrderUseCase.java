package com.sparta.voicecommerce.application.order.usecase;

import com.sparta.voicecommerce.application.order.dto.OrderResponse;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import com.sparta.voicecommerce.domain.order.exception.OrderNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 주문 상세 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetOrderUseCase {

    private final OrderLedger orderLedger;

    /**
     * @throws OrderNotFoundException 주문 ID가 원장에 없는 경우
     */
    public OrderResponse execute(String orderId) {
        return orderLedger.findById(orderId)
                .map(OrderResponse::from)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
