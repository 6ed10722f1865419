package com.sparta.voicecommerce.application.product.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 마지막 검색 결과 중 이어서 안내할 상품 묶음
 */
public record ProductPageResponse(
        @Schema(description = "이번에 안내할 상품 목록")
        List<ProductResponse> products,

        @Schema(description = "검색 결과 내 시작 위치 (0부터)", example = "5")
        int offset,

        @Schema(description = "아직 안내하지 않은 상품 수", example = "2")
        int remainingCount
) {
}
