package com.sparta.voicecommerce.application.cart;

import com.sparta.voicecommerce.application.cart.dto.AddToCartRequest;
import com.sparta.voicecommerce.application.cart.dto.AddToCartResponse;
import com.sparta.voicecommerce.application.cart.usecase.AddToCartUseCase;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import com.sparta.voicecommerce.domain.product.exception.ProductNotFoundException;
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
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("장바구니 상품 추가 UseCase 테스트")
class AddToCartUseCaseTest {

    @Mock
    private ShoppingSessionRepository sessionRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private AddToCartUseCase addToCartUseCase;

    private ShoppingSession session;

    @BeforeEach
    void setUp() {
        session = ShoppingSession.start("room-1", LocalDateTime.of(2025, 11, 28, 10, 0));
    }

    @Test
    @DisplayName("후디 M 1개를 두 번 담으면 한 항목의 수량이 2가 된다")
    void 같은_후디_두번_담기() {
        // given
        given(productRepository.findByName("Black Pullover Hoodie"))
                .willReturn(Optional.of(ProductFixture.blackHoodie()));
        given(sessionRepository.findOrCreate("room-1")).willReturn(session);
        AddToCartRequest request = new AddToCartRequest("Black Pullover Hoodie", 1, "M");

        // when
        addToCartUseCase.execute("room-1", request);
        AddToCartResponse response = addToCartUseCase.execute("room-1", request);

        // then
        assertThat(response.cart().items()).hasSize(1);
        assertThat(response.item().quantity()).isEqualTo(2);
        assertThat(response.item().variant()).isEqualTo("M");
        assertThat(response.addedQuantity()).isEqualTo(1);
        assertThat(response.cart().totalAmount()).isEqualTo(3600);
    }

    @Test
    @DisplayName("0개를 담으면 1개로 보정된다")
    void 수량_0_보정() {
        // given
        given(productRepository.findByName("Classic White Mug"))
                .willReturn(Optional.of(ProductFixture.whiteMug()));
        given(sessionRepository.findOrCreate("room-1")).willReturn(session);

        // when
        AddToCartResponse response = addToCartUseCase.execute("room-1",
                new AddToCartRequest("Classic White Mug", 0, null));

        // then
        assertThat(response.addedQuantity()).isEqualTo(1);
        assertThat(response.item().quantity()).isEqualTo(1);
        assertThat(response.item().variant()).isNull();
    }

    @Test
    @DisplayName("카탈로그에 없는 상품명은 ProductNotFoundException을 던지고 장바구니는 그대로다")
    void 없는_상품() {
        // given
        given(productRepository.findByName("Flying Carpet")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> addToCartUseCase.execute("room-1",
                new AddToCartRequest("Flying Carpet", 1, null)))
                .isInstanceOf(ProductNotFoundException.class)
                .hasMessageContaining("Flying Carpet");
        then(sessionRepository).should(never()).findOrCreate(any());
        assertThat(session.getCart().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("카탈로그를 불러올 수 없으면 상품을 찾지 못한 것으로 처리한다")
    void 카탈로그_불가() {
        // given
        given(productRepository.findByName("Classic White Mug"))
                .willThrow(new CatalogUnavailableException("상품 카탈로그 파일이 없습니다"));

        // when & then
        assertThatThrownBy(() -> addToCartUseCase.execute("room-1",
                new AddToCartRequest("Classic White Mug", 1, null)))
                .isInstanceOf(ProductNotFoundException.class);
    }
}
