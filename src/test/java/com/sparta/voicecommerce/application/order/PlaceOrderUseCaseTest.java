package com.sparta.voicecommerce.application.order;

import com.sparta.voicecommerce.application.order.dto.OrderCommitResponse;
import com.sparta.voicecommerce.application.order.usecase.PlaceOrderUseCase;
import com.sparta.voicecommerce.common.exception.PersistenceException;
import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.cart.exception.EmptyCartException;
import com.sparta.voicecommerce.domain.order.Order;
import com.sparta.voicecommerce.domain.order.OrderCommitResult;
import com.sparta.voicecommerce.domain.order.OrderItem;
import com.sparta.voicecommerce.domain.order.service.OrderFactory;
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

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("장바구니 주문 UseCase 테스트")
class PlaceOrderUseCaseTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 28, 10, 15, 30);

    @Mock
    private ShoppingSessionRepository sessionRepository;

    @Mock
    private OrderFactory orderFactory;

    @InjectMocks
    private PlaceOrderUseCase placeOrderUseCase;

    private ShoppingSession session;

    @BeforeEach
    void setUp() {
        session = ShoppingSession.start("room-1", NOW);
        given(sessionRepository.findOrCreate("room-1")).willReturn(session);
    }

    @Test
    @DisplayName("주문에 성공하면 장바구니가 비워진다")
    void 주문_성공시_장바구니_비움() {
        // given
        session.getCart().addItem(ProductFixture.greyHoodie(), 1, "L");
        Order order = Order.confirm("order-0001",
                List.of(OrderItem.of(ProductFixture.greyHoodie(), 1, "L")), NOW);
        given(orderFactory.commit(session.getCart())).willReturn(new OrderCommitResult(order, List.of()));

        // when
        OrderCommitResponse response = placeOrderUseCase.execute("room-1");

        // then
        assertThat(response.order().orderId()).isEqualTo("order-0001");
        assertThat(response.order().total()).isEqualTo(2100);
        assertThat(response.order().status()).isEqualTo("confirmed");
        assertThat(response.droppedLineCount()).isZero();
        assertThat(session.getCart().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("원장 저장에 실패하면 장바구니는 그대로 남는다")
    void 저장_실패시_장바구니_유지() {
        // given
        session.getCart().addItem(ProductFixture.greyHoodie(), 1, "L");
        given(orderFactory.commit(session.getCart()))
                .willThrow(new PersistenceException("주문 원장 저장에 실패했습니다", new IOException("disk full")));

        // when & then
        assertThatThrownBy(() -> placeOrderUseCase.execute("room-1"))
                .isInstanceOf(PersistenceException.class);
        assertThat(session.getCart().size()).isEqualTo(1);
        assertThat(session.getCart().getItems().get(0).getVariant()).isEqualTo("L");
    }

    @Test
    @DisplayName("빈 장바구니는 주문하지 않고 EmptyCartException을 던진다")
    void 빈_장바구니() {
        assertThatThrownBy(() -> placeOrderUseCase.execute("room-1"))
                .isInstanceOf(EmptyCartException.class);
        then(orderFactory).should(never()).commit(any(Cart.class));
    }
}
