package com.sparta.voicecommerce.application.session.usecase;

import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 대화 종료 UseCase
 * 세션과 함께 장바구니가 사라진다 (주문되지 않은 장바구니는 저장하지 않는다)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EndSessionUseCase {

    private final ShoppingSessionRepository sessionRepository;

    public void execute(String sessionId) {
        sessionRepository.findById(sessionId)
                .ifPresent(session -> log.info("대화 세션 종료 - sessionId={}, 남은 장바구니 항목={}",
                        sessionId, session.getCart().size()));
        sessionRepository.delete(sessionId);
    }
}
