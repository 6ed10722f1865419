package com.sparta.voicecommerce.domain.product;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 카탈로그 상품 (불변)
 * id와 name은 카탈로그 전체에서 유일하며, 대화 드라이버는 name으로 상품을 찾는다
 */
@Getter
public class Product {

    public static final String SIZES_ATTRIBUTE = "sizes";

    private final String productId;
    private final String name;
    private final ProductCategory category;
    private final long price;
    private final String color;
    private final String description;
    private final Map<String, Object> attributes;

    @Builder
    private Product(String productId, String name, ProductCategory category, long price,
                    String color, String description, Map<String, Object> attributes) {
        if (price < 0) {
            throw new IllegalArgumentException("상품 가격은 음수일 수 없습니다: " + name);
        }
        this.productId = productId;
        this.name = name;
        this.category = category;
        this.price = price;
        this.color = color;
        this.description = description == null ? "" : description;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 선택 가능한 사이즈 목록 (카탈로그에 정의된 순서 유지)
     */
    public List<String> getSizes() {
        Object sizes = attributes.get(SIZES_ATTRIBUTE);
        if (sizes instanceof List<?> values) {
            return values.stream()
                    .map(String::valueOf)
                    .toList();
        }
        return List.of();
    }

    public boolean hasColor() {
        return color != null && !color.isBlank();
    }
}
