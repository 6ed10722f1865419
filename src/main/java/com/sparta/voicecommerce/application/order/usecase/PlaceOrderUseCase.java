package com.sparta.voicecommerce.application.order.usecase;

import com.sparta.voicecommerce.application.order.dto.OrderCommitResponse;
import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.cart.exception.EmptyCartException;
import com.sparta.voicecommerce.domain.order.OrderCommitResult;
import com.sparta.voicecommerce.domain.order.service.OrderFactory;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 주문 UseCase
 *
 * 주문 흐름:
 * 1. 세션 장바구니 확인 (비어 있으면 EmptyCartException)
 * 2. OrderFactory로 주문 확정 및 원장 기록
 * 3. 기록에 성공한 경우에만 장바구니를 비운다
 *
 * 어느 단계에서든 실패하면 장바구니는 그대로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaceOrderUseCase {

    private final ShoppingSessionRepository sessionRepository;
    private final OrderFactory orderFactory;

    public OrderCommitResponse execute(String sessionId) {
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        Cart cart = session.getCart();
        if (cart.isEmpty()) {
            throw new EmptyCartException("장바구니가 비어 있습니다");
        }

        OrderCommitResult result = orderFactory.commit(cart);
        cart.clear();

        log.info("장바구니 주문 완료 - sessionId={}, orderId={}, dropped={}",
                sessionId, result.order().getOrderId(), result.droppedLineCount());

        return OrderCommitResponse.from(result);
    }
}
