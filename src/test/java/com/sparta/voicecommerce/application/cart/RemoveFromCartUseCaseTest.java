package com.sparta.voicecommerce.application.cart;

import com.sparta.voicecommerce.application.cart.dto.CartItemResponse;
import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.application.cart.dto.UpdateCartItemRequest;
import com.sparta.voicecommerce.application.cart.usecase.RemoveFromCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.UpdateCartItemUseCase;
import com.sparta.voicecommerce.domain.cart.exception.CartItemNotFoundException;
import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import com.sparta.voicecommerce.fixture.ProductFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("장바구니 삭제/수량 변경 UseCase 테스트")
class RemoveFromCartUseCaseTest {

    @Mock
    private ShoppingSessionRepository sessionRepository;

    private RemoveFromCartUseCase removeFromCartUseCase;
    private UpdateCartItemUseCase updateCartItemUseCase;
    private ShoppingSession session;

    @BeforeEach
    void setUp() {
        removeFromCartUseCase = new RemoveFromCartUseCase(sessionRepository);
        updateCartItemUseCase = new UpdateCartItemUseCase(sessionRepository);
        session = ShoppingSession.start("room-1", LocalDateTime.of(2025, 11, 28, 10, 0));
        session.getCart().addItem(ProductFixture.blackHoodie(), 1, "M");
        given(sessionRepository.findOrCreate("room-1")).willReturn(session);
    }

    @Test
    @DisplayName("M 사이즈만 담긴 장바구니에서 L 사이즈 삭제를 요청하면 실패하고 장바구니는 그대로다")
    void 다른_사이즈_삭제_실패() {
        // when & then
        assertThatThrownBy(() -> removeFromCartUseCase.execute("room-1", "Black Pullover Hoodie", "L"))
                .isInstanceOf(CartItemNotFoundException.class);
        assertThat(session.getCart().size()).isEqualTo(1);
        assertThat(session.getCart().getItems().get(0).getVariant()).isEqualTo("M");
    }

    @Test
    @DisplayName("상품명과 사이즈가 일치하면 삭제된다")
    void 일치하는_항목_삭제() {
        // when
        CartItemResponse removed = removeFromCartUseCase.execute("room-1", "Black Pullover Hoodie", "M");

        // then
        assertThat(removed.productName()).isEqualTo("Black Pullover Hoodie");
        assertThat(removed.variant()).isEqualTo("M");
        assertThat(session.getCart().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("수량을 0 이하로 변경하면 항목이 삭제된다")
    void 수량_0_변경_삭제() {
        // when
        CartResponse cart = updateCartItemUseCase.execute("room-1",
                new UpdateCartItemRequest("Black Pullover Hoodie", "M", 0));

        // then
        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("수량을 변경하면 합계가 다시 계산된다")
    void 수량_변경() {
        // when
        CartResponse cart = updateCartItemUseCase.execute("room-1",
                new UpdateCartItemRequest("Black Pullover Hoodie", "M", 3));

        // then
        assertThat(cart.items().get(0).quantity()).isEqualTo(3);
        assertThat(cart.totalItemCount()).isEqualTo(3);
        assertThat(cart.totalAmount()).isEqualTo(5400);
    }
}
