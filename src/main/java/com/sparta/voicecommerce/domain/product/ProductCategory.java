package com.sparta.voicecommerce.domain.product;

import com.sparta.voicecommerce.domain.product.exception.InvalidProductCategoryException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 상품 카테고리
 * 카탈로그와 검색 조건 모두 이 값으로만 카테고리를 표현한다
 */
public enum ProductCategory {

    MUG("mug", false),
    TSHIRT("tshirt", true),
    HOODIE("hoodie", true),
    BOTTLE("bottle", false),
    CAP("cap", false);

    private final String code;
    private final boolean apparel;

    ProductCategory(String code, boolean apparel) {
        this.code = code;
        this.apparel = apparel;
    }

    public String getCode() {
        return code;
    }

    /**
     * 사이즈를 안내해야 하는 의류 카테고리인지 여부
     */
    public boolean isApparel() {
        return apparel;
    }

    /**
     * code로부터 카테고리 찾기 (대소문자 무시)
     * @param code 카테고리 코드 ("mug", "tshirt", "hoodie", "bottle", "cap")
     * @return 일치하는 카테고리
     * @throws InvalidProductCategoryException 일치하는 카테고리가 없는 경우
     */
    public static ProductCategory from(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidProductCategoryException(code);
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(category -> category.code.equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidProductCategoryException(code));
    }

    /**
     * 안내용 카테고리 코드 목록 ("mug, tshirt, ...")
     */
    public static String codes() {
        return Arrays.stream(values())
                .map(ProductCategory::getCode)
                .collect(Collectors.joining(", "));
    }
}
