package com.sparta.voicecommerce.domain.product;

import com.sparta.voicecommerce.domain.product.exception.InvalidProductCategoryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProductCategory 테스트")
class ProductCategoryTest {

    @Test
    @DisplayName("코드는 대소문자와 앞뒤 공백을 무시하고 찾는다")
    void 코드로_카테고리_찾기() {
        assertThat(ProductCategory.from("hoodie")).isEqualTo(ProductCategory.HOODIE);
        assertThat(ProductCategory.from("TShirt")).isEqualTo(ProductCategory.TSHIRT);
        assertThat(ProductCategory.from(" mug ")).isEqualTo(ProductCategory.MUG);
    }

    @Test
    @DisplayName("알 수 없는 카테고리는 InvalidProductCategoryException을 던진다")
    void 알수없는_카테고리() {
        assertThatThrownBy(() -> ProductCategory.from("sofa"))
                .isInstanceOf(InvalidProductCategoryException.class)
                .hasMessageContaining("sofa");
    }

    @Test
    @DisplayName("tshirt와 hoodie만 사이즈를 안내하는 의류 카테고리다")
    void 의류_카테고리_여부() {
        assertThat(ProductCategory.TSHIRT.isApparel()).isTrue();
        assertThat(ProductCategory.HOODIE.isApparel()).isTrue();
        assertThat(ProductCategory.MUG.isApparel()).isFalse();
        assertThat(ProductCategory.CAP.isApparel()).isFalse();
    }

    @Test
    @DisplayName("안내용 코드 목록은 선언 순서를 따른다")
    void 코드_목록() {
        assertThat(ProductCategory.codes()).isEqualTo("mug, tshirt, hoodie, bottle, cap");
    }
}
