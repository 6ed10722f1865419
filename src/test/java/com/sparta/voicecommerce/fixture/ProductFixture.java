package com.sparta.voicecommerce.fixture;

import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductCategory;

import java.util.List;
import java.util.Map;

/**
 * 테스트용 상품 데이터
 * 기본 카탈로그(catalog/products.json)의 상품과 같은 값을 사용한다
 */
public final class ProductFixture {

    private static final List<String> APPAREL_SIZES = List.of("S", "M", "L", "XL");

    private ProductFixture() {
    }

    public static Product blackHoodie() {
        return Product.builder()
                .productId("hoodie-01")
                .name("Black Pullover Hoodie")
                .category(ProductCategory.HOODIE)
                .price(1800)
                .color("black")
                .description("A warm black hoodie with a front pocket")
                .attributes(Map.of(Product.SIZES_ATTRIBUTE, APPAREL_SIZES))
                .build();
    }

    public static Product greyHoodie() {
        return Product.builder()
                .productId("hoodie-02")
                .name("Grey Zip Hoodie")
                .category(ProductCategory.HOODIE)
                .price(2100)
                .color("grey")
                .description("A grey hoodie with full zip closure")
                .attributes(Map.of(Product.SIZES_ATTRIBUTE, APPAREL_SIZES))
                .build();
    }

    public static Product whiteMug() {
        return Product.builder()
                .productId("mug-01")
                .name("Classic White Mug")
                .category(ProductCategory.MUG)
                .price(450)
                .color("white")
                .description("A simple white ceramic mug that holds 350 ml")
                .build();
    }

    public static Product product(String productId, String name, ProductCategory category, long price, String color) {
        return Product.builder()
                .productId(productId)
                .name(name)
                .category(category)
                .price(price)
                .color(color)
                .description(name)
                .build();
    }
}
