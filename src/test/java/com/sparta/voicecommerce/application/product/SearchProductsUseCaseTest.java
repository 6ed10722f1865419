package com.sparta.voicecommerce.application.product;

import com.sparta.voicecommerce.application.product.dto.ProductResponse;
import com.sparta.voicecommerce.application.product.dto.ProductSearchResponse;
import com.sparta.voicecommerce.application.product.usecase.SearchProductsUseCase;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductCategory;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.ProductSearchCondition;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import com.sparta.voicecommerce.fixture.ProductFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("상품 검색 UseCase 테스트")
class SearchProductsUseCaseTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private ShoppingSessionRepository sessionRepository;

    @InjectMocks
    private SearchProductsUseCase searchProductsUseCase;

    private List<Product> catalog;

    @BeforeEach
    void setUp() {
        catalog = List.of(
                ProductFixture.whiteMug(),
                ProductFixture.product("tshirt-01", "Basic Black T-Shirt", ProductCategory.TSHIRT, 599, "black"),
                ProductFixture.blackHoodie(),
                ProductFixture.greyHoodie(),
                ProductFixture.product("cap-01", "Black Baseball Cap", ProductCategory.CAP, 499, "black"));
    }

    @Test
    @DisplayName("2000 이하의 검은색 후디를 찾으면 Black Pullover Hoodie만 나온다")
    void 후디_가격_색상_검색() {
        // given
        given(productRepository.findAll()).willReturn(catalog);

        // when
        ProductSearchResponse response = searchProductsUseCase.execute(
                ProductSearchCondition.of("hoodie", 2000L, "black", null));

        // then
        assertThat(response.catalogAvailable()).isTrue();
        assertThat(response.products()).hasSize(1);
        ProductResponse hoodie = response.products().get(0);
        assertThat(hoodie.name()).isEqualTo("Black Pullover Hoodie");
        assertThat(hoodie.price()).isEqualTo(1800);
        assertThat(hoodie.sizes()).containsExactly("S", "M", "L", "XL");
    }

    @Test
    @DisplayName("조건이 없으면 카탈로그 전체를 카탈로그 순서대로 반환한다")
    void 조건없음_전체_조회() {
        // given
        given(productRepository.findAll()).willReturn(catalog);

        // when
        ProductSearchResponse response = searchProductsUseCase.execute(ProductSearchCondition.none());

        // then
        assertThat(response.products())
                .extracting(ProductResponse::productId)
                .containsExactly("mug-01", "tshirt-01", "hoodie-01", "hoodie-02", "cap-01");
    }

    @Test
    @DisplayName("2000 이하의 후디를 찾으면 Black Pullover Hoodie만 나온다")
    void 후디_가격_검색() {
        // given
        given(productRepository.findAll()).willReturn(catalog);

        // when
        ProductSearchResponse response = searchProductsUseCase.execute(
                ProductSearchCondition.of("hoodie", 2000L, null, null));

        // then
        assertThat(response.products())
                .extracting(ProductResponse::productId, ProductResponse::name, ProductResponse::price)
                .containsExactly(tuple("hoodie-01", "Black Pullover Hoodie", 1800L));
    }

    @Test
    @DisplayName("검색 결과에 같은 조건을 다시 적용해도 결과가 바뀌지 않는다")
    void 재적용_멱등성() {
        for (ProductSearchCondition condition : sampleConditions()) {
            // given
            List<String> once = searchIds(catalog, condition);

            // when
            List<String> twice = searchIds(productsOf(once), condition);

            // then
            assertThat(twice).as("조건 %s", condition).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("필터를 적용하는 순서를 바꿔도 결과가 같다")
    void 필터_순서_교환() {
        for (ProductSearchCondition condition : sampleConditions()) {
            // given
            List<ProductSearchCondition> stages = singleFilterStages(condition);
            List<ProductSearchCondition> reversed = new ArrayList<>(stages);
            Collections.reverse(reversed);

            // when
            List<String> forward = searchInStages(stages);
            List<String> backward = searchInStages(reversed);
            List<String> combined = searchIds(catalog, condition);

            // then
            assertThat(forward).as("조건 %s", condition).isEqualTo(backward);
            assertThat(forward).as("조건 %s", condition).isEqualTo(combined);
        }
    }

    @Test
    @DisplayName("검색 결과는 항상 카탈로그 순서를 유지하는 부분 목록이다")
    void 카탈로그_부분순서() {
        List<String> catalogIds = catalog.stream().map(Product::getProductId).toList();

        for (ProductSearchCondition condition : sampleConditions()) {
            // when
            List<String> result = searchIds(catalog, condition);

            // then
            assertThat(catalogIds).as("조건 %s", condition).containsAll(result);
            assertThat(result.stream().map(catalogIds::indexOf).toList())
                    .as("조건 %s", condition)
                    .isSorted()
                    .doesNotHaveDuplicates();
        }
    }

    private List<ProductSearchCondition> sampleConditions() {
        return List.of(
                ProductSearchCondition.none(),
                ProductSearchCondition.of("hoodie", 2000L, null, null),
                ProductSearchCondition.of(null, 600L, "black", null),
                ProductSearchCondition.of("cap", null, "BLACK", "cap"),
                ProductSearchCondition.of(null, 2500L, null, "hoodie"),
                ProductSearchCondition.of("tshirt", 500L, null, null),
                ProductSearchCondition.of(null, null, "black", "black"));
    }

    private List<ProductSearchCondition> singleFilterStages(ProductSearchCondition condition) {
        return List.of(
                new ProductSearchCondition(condition.category(), null, null, null),
                new ProductSearchCondition(null, condition.maxPrice(), null, null),
                new ProductSearchCondition(null, null, condition.color(), null),
                new ProductSearchCondition(null, null, null, condition.keyword()));
    }

    private List<String> searchInStages(List<ProductSearchCondition> stages) {
        List<Product> current = catalog;
        for (ProductSearchCondition stage : stages) {
            current = productsOf(searchIds(current, stage));
        }
        return current.stream().map(Product::getProductId).toList();
    }

    private List<String> searchIds(List<Product> source, ProductSearchCondition condition) {
        given(productRepository.findAll()).willReturn(source);
        return searchProductsUseCase.execute(condition).products().stream()
                .map(ProductResponse::productId)
                .toList();
    }

    private List<Product> productsOf(List<String> productIds) {
        return catalog.stream()
                .filter(product -> productIds.contains(product.getProductId()))
                .toList();
    }

    @Test
    @DisplayName("일치하는 상품이 없으면 빈 목록을 반환한다")
    void 일치없음() {
        given(productRepository.findAll()).willReturn(catalog);

        ProductSearchResponse response = searchProductsUseCase.execute(
                ProductSearchCondition.of("bottle", null, null, null));

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.catalogAvailable()).isTrue();
    }

    @Test
    @DisplayName("카탈로그를 불러올 수 없으면 예외 대신 빈 결과와 사유를 반환한다")
    void 카탈로그_불가() {
        // given
        given(productRepository.findAll()).willThrow(new CatalogUnavailableException("상품 카탈로그 파일이 없습니다"));

        // when
        ProductSearchResponse response = searchProductsUseCase.execute("room-1", ProductSearchCondition.none());

        // then
        assertThat(response.isEmpty()).isTrue();
        assertThat(response.catalogAvailable()).isFalse();
        assertThat(response.loadError()).contains("카탈로그");
        then(sessionRepository).should(never()).findOrCreate(any());
    }

    @Test
    @DisplayName("세션 ID가 있으면 검색 결과를 세션에 기억한다")
    void 세션에_검색결과_기억() {
        // given
        ShoppingSession session = ShoppingSession.start("room-1", LocalDateTime.of(2025, 11, 28, 10, 0));
        given(productRepository.findAll()).willReturn(catalog);
        given(sessionRepository.findOrCreate("room-1")).willReturn(session);

        // when
        searchProductsUseCase.execute("room-1", ProductSearchCondition.of("hoodie", null, null, null));

        // then
        assertThat(session.getLastProductsShown())
                .extracting(Product::getName)
                .containsExactly("Black Pullover Hoodie", "Grey Zip Hoodie");
        assertThat(session.getCurrentCategory()).isEqualTo(ProductCategory.HOODIE);
    }
}
