package com.sparta.voicecommerce.domain.product;

import java.util.Locale;

/**
 * 상품 검색 조건
 * 모든 필터는 선택값이며 AND로 결합된다. 빈 문자열과 0 이하의 가격은 "조건 없음"으로 본다.
 *
 * @param category 카테고리 (정확히 일치)
 * @param maxPrice 최대 가격 (이하 포함)
 * @param color    색상 (대소문자 무시, 정확히 일치)
 * @param keyword  상품명 또는 설명에 포함된 키워드 (대소문자 무시)
 */
public record ProductSearchCondition(
        ProductCategory category,
        Long maxPrice,
        String color,
        String keyword
) {

    public ProductSearchCondition {
        maxPrice = (maxPrice == null || maxPrice <= 0) ? null : maxPrice;
        color = blankToNull(color);
        keyword = blankToNull(keyword);
    }

    /**
     * 드라이버가 넘긴 원시 값으로 검색 조건 생성
     * @throws com.sparta.voicecommerce.domain.product.exception.InvalidProductCategoryException 알 수 없는 카테고리
     */
    public static ProductSearchCondition of(String category, Long maxPrice, String color, String keyword) {
        ProductCategory parsed = blankToNull(category) == null ? null : ProductCategory.from(category);
        return new ProductSearchCondition(parsed, maxPrice, color, keyword);
    }

    public static ProductSearchCondition none() {
        return new ProductSearchCondition(null, null, null, null);
    }

    public boolean hasCategory() {
        return category != null;
    }

    public boolean hasMaxPrice() {
        return maxPrice != null;
    }

    public boolean hasColor() {
        return color != null;
    }

    public boolean hasKeyword() {
        return keyword != null;
    }

    public boolean matchesCategory(Product product) {
        return !hasCategory() || category == product.getCategory();
    }

    public boolean matchesMaxPrice(Product product) {
        return !hasMaxPrice() || product.getPrice() <= maxPrice;
    }

    public boolean matchesColor(Product product) {
        return !hasColor() || (product.hasColor() && product.getColor().equalsIgnoreCase(color));
    }

    public boolean matchesKeyword(Product product) {
        if (!hasKeyword()) {
            return true;
        }
        String lowered = keyword.toLowerCase(Locale.ROOT);
        return nullSafeLower(product.getName()).contains(lowered)
                || nullSafeLower(product.getDescription()).contains(lowered);
    }

    public boolean matches(Product product) {
        return matchesCategory(product)
                && matchesMaxPrice(product)
                && matchesColor(product)
                && matchesKeyword(product);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static String nullSafeLower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
