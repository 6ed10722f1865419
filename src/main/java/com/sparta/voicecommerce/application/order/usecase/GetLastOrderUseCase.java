package com.sparta.voicecommerce.application.order.usecase;

import com.sparta.voicecommerce.application.order.dto.OrderResponse;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 가장 최근 주문 조회 UseCase
 * 원장이 비어 있으면 empty (오류 아님)
 */
@Service
@RequiredArgsConstructor
public class GetLastOrderUseCase {

    private final OrderLedger orderLedger;

    public Optional<OrderResponse> execute() {
        return orderLedger.findLast()
                .map(OrderResponse::from);
    }
}
