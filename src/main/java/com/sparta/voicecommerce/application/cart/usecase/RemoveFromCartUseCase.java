package com.sparta.voicecommerce.application.cart.usecase;

import com.sparta.voicecommerce.application.cart.dto.CartItemResponse;
import com.sparta.voicecommerce.domain.cart.CartItem;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 상품 삭제 UseCase
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoveFromCartUseCase {

    private final ShoppingSessionRepository sessionRepository;

    /**
     * 상품명과 옵션이 정확히 일치하는 첫 항목 삭제
     *
     * @return 삭제된 항목
     * @throws com.sparta.voicecommerce.domain.cart.exception.CartItemNotFoundException 일치하는 항목이 없는 경우
     */
    public CartItemResponse execute(String sessionId, String productName, String variant) {
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        CartItem removed = session.getCart().removeItem(productName, variant);

        log.info("장바구니 삭제 - sessionId={}, product={}, variant={}, remainingLines={}",
                sessionId, removed.getProductName(), removed.getVariant(), session.getCart().size());

        return CartItemResponse.from(removed);
    }
}
