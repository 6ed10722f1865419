package com.sparta.voicecommerce.application.cart.usecase;

import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.application.cart.dto.UpdateCartItemRequest;
import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 수량 변경 UseCase
 * 0 이하의 수량은 항목 삭제로 처리한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpdateCartItemUseCase {

    private final ShoppingSessionRepository sessionRepository;

    public CartResponse execute(String sessionId, UpdateCartItemRequest request) {
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        Cart cart = session.getCart();

        boolean retained = cart.updateQuantity(request.productName(), request.variant(), request.quantity())
                .isPresent();

        log.info("장바구니 수량 변경 - sessionId={}, product={}, variant={}, quantity={}, removed={}",
                sessionId, request.productName(), request.variant(), request.quantity(), !retained);

        return CartResponse.of(sessionId, cart);
    }
}
