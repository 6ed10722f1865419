package com.sparta.voicecommerce.application.product.dto;

import com.sparta.voicecommerce.domain.product.Product;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record ProductResponse(
        @Schema(description = "상품 ID", example = "hoodie-01")
        String productId,

        @Schema(description = "상품명", example = "Black Pullover Hoodie")
        String name,

        @Schema(description = "가격 (INR)", example = "1800")
        long price,

        @Schema(description = "카테고리", example = "hoodie")
        String category,

        @Schema(description = "색상", example = "black")
        String color,

        @Schema(description = "상품 설명")
        String description,

        @Schema(description = "선택 가능한 사이즈", example = "[\"S\", \"M\", \"L\", \"XL\"]")
        List<String> sizes
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getProductId(),
                product.getName(),
                product.getPrice(),
                product.getCategory().getCode(),
                product.getColor(),
                product.getDescription(),
                product.getSizes()
        );
    }
}
