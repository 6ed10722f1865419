package com.sparta.voicecommerce.application.product.usecase;

import com.sparta.voicecommerce.application.product.dto.ProductPageResponse;
import com.sparta.voicecommerce.application.product.dto.ProductResponse;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 마지막 검색 결과 이어서 보기 UseCase
 */
@Service
@RequiredArgsConstructor
public class BrowseMoreProductsUseCase {

    private final ShoppingSessionRepository sessionRepository;

    public ProductPageResponse execute(String sessionId, int pageSize) {
        ShoppingSession session = sessionRepository.findOrCreate(sessionId);
        int offset = session.getPresentedCount();
        List<Product> page = session.nextProducts(pageSize);

        return new ProductPageResponse(
                page.stream()
                        .map(ProductResponse::from)
                        .toList(),
                offset,
                session.getRemainingProductCount()
        );
    }
}
