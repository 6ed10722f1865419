package com.sparta.voicecommerce.application.cart.usecase;

import com.sparta.voicecommerce.application.cart.dto.AddToCartRequest;
import com.sparta.voicecommerce.application.cart.dto.AddToCartResponse;
import com.sparta.voicecommerce.application.cart.dto.CartItemResponse;
import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.cart.CartConstants;
import com.sparta.voicecommerce.domain.cart.CartItem;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import com.sparta.voicecommerce.domain.product.exception.ProductNotFoundException;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 장바구니 상품 추가 UseCase
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddToCartUseCase {

    private final ShoppingSessionRepository sessionRepository;
    private final ProductRepository productRepository;

    /**
     * 장바구니에 상품 추가
     * 상품을 찾지 못하면 장바구니는 변경되지 않는다
     *
     * @param sessionId 대화 세션 ID
     * @param request   추가 요청 정보
     * @return 추가된 항목과 장바구니 전체
     * @throws ProductNotFoundException 상품명이 카탈로그에 없거나 카탈로그를 불러올 수 없는 경우
     */
    public AddToCartResponse execute(String sessionId, AddToCartRequest request) {
        // 1. 상품 확인
        Product product = findProduct(request.productName());

        // 2. 세션 장바구니에 추가
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        Cart cart = session.getCart();
        int addedQuantity = Math.max(request.quantity(), CartConstants.MIN_QUANTITY);
        CartItem item = cart.addItem(product, addedQuantity, request.variant());

        log.info("장바구니 추가 - sessionId={}, product={}, variant={}, quantity={}, lines={}",
                sessionId, product.getName(), item.getVariant(), addedQuantity, cart.size());

        // 3. 응답 생성
        return new AddToCartResponse(
                CartItemResponse.from(item),
                addedQuantity,
                CartResponse.of(sessionId, cart)
        );
    }

    private Product findProduct(String productName) {
        try {
            return productRepository.findByName(productName)
                    .orElseThrow(() -> new ProductNotFoundException(productName));
        } catch (CatalogUnavailableException e) {
            log.warn("카탈로그를 불러올 수 없어 상품을 찾지 못했습니다 - product={}, reason={}",
                    productName, e.getMessage());
            throw new ProductNotFoundException(productName);
        }
    }
}
