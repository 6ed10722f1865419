package com.sparta.voicecommerce.application.order.usecase;

import com.sparta.voicecommerce.application.order.dto.OrderResponse;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 주문 이력 조회 UseCase (원장 기록 순서)
 */
@Service
@RequiredArgsConstructor
public class GetOrdersUseCase {

    private final OrderLedger orderLedger;

    public List<OrderResponse> execute() {
        return orderLedger.findAll().stream()
                .map(OrderResponse::from)
                .toList();
    }
}
