package com.sparta.voicecommerce.application.cart.usecase;

import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 비우기 UseCase
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClearCartUseCase {

    private final ShoppingSessionRepository sessionRepository;

    public void execute(String sessionId) {
        sessionRepository.findById(sessionId)
                .ifPresent(session -> {
                    session.getCart().clear();
                    log.info("장바구니 비움 - sessionId={}", sessionId);
                });
    }
}
