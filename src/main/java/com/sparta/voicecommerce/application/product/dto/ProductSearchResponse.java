package com.sparta.voicecommerce.application.product.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 상품 검색 응답
 * 카탈로그를 불러오지 못한 경우에도 오류 대신 빈 목록과 사유를 돌려준다
 */
public record ProductSearchResponse(
        @Schema(description = "검색된 상품 목록 (카탈로그 순서)")
        List<ProductResponse> products,

        @Schema(description = "카탈로그 사용 가능 여부", example = "true")
        boolean catalogAvailable,

        @Schema(description = "카탈로그 로드 실패 사유", nullable = true)
        String loadError
) {
    public static ProductSearchResponse of(List<ProductResponse> products) {
        return new ProductSearchResponse(List.copyOf(products), true, null);
    }

    public static ProductSearchResponse unavailable(String loadError) {
        return new ProductSearchResponse(List.of(), false, loadError);
    }

    public int count() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }
}
