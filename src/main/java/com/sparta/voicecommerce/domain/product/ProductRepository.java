package com.sparta.voicecommerce.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * 상품 카탈로그 Repository 인터페이스 (읽기 전용)
 */
public interface ProductRepository {

    /**
     * 카탈로그에 저장된 순서대로 전체 상품 조회
     * @throws com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException 카탈로그를 읽을 수 없는 경우
     */
    List<Product> findAll();

    /**
     * 상품명 정확히 일치(대소문자 구분)로 조회
     */
    Optional<Product> findByName(String name);
}
