package com.sparta.voicecommerce.application.order.usecase;

import com.sparta.voicecommerce.application.order.dto.CreateOrderRequest;
import com.sparta.voicecommerce.application.order.dto.OrderCommitResponse;
import com.sparta.voicecommerce.application.order.dto.OrderLineRequest;
import com.sparta.voicecommerce.domain.order.OrderLineCommand;
import com.sparta.voicecommerce.domain.order.service.OrderFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 주문 항목 직접 지정 주문 UseCase
 */
@Service
@RequiredArgsConstructor
public class CreateOrderUseCase {

    private final OrderFactory orderFactory;

    public OrderCommitResponse execute(CreateOrderRequest request) {
        List<OrderLineCommand> lines = request.items().stream()
                .map(OrderLineRequest::toCommand)
                .toList();
        return OrderCommitResponse.from(orderFactory.commit(lines));
    }
}
