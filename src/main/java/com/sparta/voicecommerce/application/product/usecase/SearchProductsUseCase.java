package com.sparta.voicecommerce.application.product.usecase;

import com.sparta.voicecommerce.application.product.dto.ProductResponse;
import com.sparta.voicecommerce.application.product.dto.ProductSearchResponse;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.ProductSearchCondition;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Predicate;

/**
 * 상품 검색 UseCase
 *
 * 모든 필터는 AND로 결합되고 결과는 카탈로그 순서를 유지한다.
 * 세션 ID가 주어지면 검색 결과를 세션의 대화 맥락에 기억한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchProductsUseCase {

    private final ProductRepository productRepository;
    private final ShoppingSessionRepository sessionRepository;

    /**
     * 세션 없이 검색 (REST 조회용)
     */
    public ProductSearchResponse execute(ProductSearchCondition condition) {
        return execute(null, condition);
    }

    /**
     * @param sessionId 검색 결과를 기억할 세션 (nullable)
     * @param condition 검색 조건
     */
    public ProductSearchResponse execute(String sessionId, ProductSearchCondition condition) {
        List<Product> catalog;
        try {
            catalog = productRepository.findAll();
        } catch (CatalogUnavailableException e) {
            log.warn("카탈로그를 불러올 수 없어 빈 검색 결과를 반환합니다: {}", e.getMessage());
            return ProductSearchResponse.unavailable(e.getMessage());
        }

        List<Product> filtered = catalog;
        log.debug("상품 검색 시작 - 전체 {}개, 조건={}", filtered.size(), condition);
        if (condition.hasCategory()) {
            filtered = filter(filtered, condition::matchesCategory);
            log.debug("카테고리 '{}' 적용 후 {}개", condition.category().getCode(), filtered.size());
        }
        if (condition.hasMaxPrice()) {
            filtered = filter(filtered, condition::matchesMaxPrice);
            log.debug("최대 가격 {} 적용 후 {}개", condition.maxPrice(), filtered.size());
        }
        if (condition.hasColor()) {
            filtered = filter(filtered, condition::matchesColor);
            log.debug("색상 '{}' 적용 후 {}개", condition.color(), filtered.size());
        }
        if (condition.hasKeyword()) {
            filtered = filter(filtered, condition::matchesKeyword);
            log.debug("키워드 '{}' 적용 후 {}개", condition.keyword(), filtered.size());
        }

        if (sessionId != null) {
            ShoppingSession session = sessionRepository.findOrCreate(sessionId);
            session.rememberSearch(filtered, condition.category());
        }

        return ProductSearchResponse.of(filtered.stream()
                .map(ProductResponse::from)
                .toList());
    }

    private List<Product> filter(List<Product> products, Predicate<Product> predicate) {
        return products.stream()
                .filter(predicate)
                .toList();
    }
}
