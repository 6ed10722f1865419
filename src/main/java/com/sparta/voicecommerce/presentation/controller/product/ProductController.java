package com.sparta.voicecommerce.presentation.controller.product;

import com.sparta.voicecommerce.application.product.dto.ProductPageResponse;
import com.sparta.voicecommerce.application.product.dto.ProductSearchResponse;
import com.sparta.voicecommerce.application.product.usecase.BrowseMoreProductsUseCase;
import com.sparta.voicecommerce.application.product.usecase.SearchProductsUseCase;
import com.sparta.voicecommerce.domain.product.ProductSearchCondition;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 상품 카탈로그 API
 */
@Tag(name = "상품 카탈로그", description = "상품 검색 API")
@Validated
@RestController
@RequiredArgsConstructor
public class ProductController {

    private final SearchProductsUseCase searchProductsUseCase;
    private final BrowseMoreProductsUseCase browseMoreProductsUseCase;

    /**
     * 상품 검색
     * GET /api/products
     */
    @Operation(summary = "상품 검색", description = "카테고리, 최대 가격, 색상, 키워드로 상품을 검색합니다. 모든 조건은 선택입니다")
    @GetMapping("/api/products")
    public ResponseEntity<ProductSearchResponse> searchProducts(
            @Parameter(description = "카테고리 (mug, tshirt, hoodie, bottle, cap)") @RequestParam(required = false) String category,
            @Parameter(description = "최대 가격 (이하 포함)") @RequestParam(required = false) Long maxPrice,
            @Parameter(description = "색상") @RequestParam(required = false) String color,
            @Parameter(description = "상품명/설명 키워드") @RequestParam(required = false) String keyword,
            @Parameter(description = "검색 결과를 기억할 세션 ID") @RequestParam(required = false) String sessionId) {

        ProductSearchCondition condition = ProductSearchCondition.of(category, maxPrice, color, keyword);
        return ResponseEntity.ok(searchProductsUseCase.execute(sessionId, condition));
    }

    /**
     * 마지막 검색 결과 이어서 보기
     * GET /api/sessions/{sessionId}/products/next
     */
    @Operation(summary = "검색 결과 이어서 보기", description = "세션의 마지막 검색 결과 중 아직 안내하지 않은 상품을 조회합니다")
    @GetMapping("/api/sessions/{sessionId}/products/next")
    public ResponseEntity<ProductPageResponse> nextProducts(
            @Parameter(description = "세션 ID") @PathVariable String sessionId,
            @Parameter(description = "조회 개수") @RequestParam(defaultValue = "5")
            @Min(value = 1, message = "조회 개수는 1 이상이어야 합니다") int size) {

        return ResponseEntity.ok(browseMoreProductsUseCase.execute(sessionId, size));
    }
}
