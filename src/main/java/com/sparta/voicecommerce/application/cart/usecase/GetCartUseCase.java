package com.sparta.voicecommerce.application.cart.usecase;

import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetCartUseCase {

    private final ShoppingSessionRepository sessionRepository;

    public CartResponse execute(String sessionId) {
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        return CartResponse.of(sessionId, session.getCart());
    }
}
