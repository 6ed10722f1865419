package com.sparta.voicecommerce.domain.order;

import com.sparta.voicecommerce.fixture.ProductFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("주문 도메인 테스트")
class OrderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 28, 10, 15, 30);

    @Test
    @DisplayName("주문 합계는 항목 합계의 합이다")
    void 주문_합계_계산() {
        // given
        List<OrderItem> items = List.of(
                OrderItem.of(ProductFixture.whiteMug(), 2, null),
                OrderItem.of(ProductFixture.blackHoodie(), 1, "M"));

        // when
        Order order = Order.confirm("order-0001", items, NOW);

        // then
        assertThat(order.getItems()).extracting(OrderItem::getLineTotal).containsExactly(900L, 1800L);
        assertThat(order.getTotal()).isEqualTo(2700L);
        assertThat(order.getCurrency()).isEqualTo("INR");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("항목이 없는 주문은 확정할 수 없다")
    void 빈_주문_확정_불가() {
        assertThatThrownBy(() -> Order.confirm("order-0001", List.of(), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("주문 ID는 원장 길이 + 1을 4자리로 채운다")
    void 주문_ID_생성() {
        assertThat(OrderConstants.nextOrderId(0)).isEqualTo("order-0001");
        assertThat(OrderConstants.nextOrderId(41)).isEqualTo("order-0042");
        assertThat(OrderConstants.nextOrderId(9999)).isEqualTo("order-10000");
    }

    @Test
    @DisplayName("주문 요청 항목의 수량은 1 이상으로, 빈 옵션은 null로 보정된다")
    void 주문요청_항목_보정() {
        OrderLineCommand line = new OrderLineCommand("Classic White Mug", 0, " ");

        assertThat(line.quantity()).isEqualTo(1);
        assertThat(line.variant()).isNull();
    }

    @Test
    @DisplayName("주문 상태는 소문자 코드로 표현된다")
    void 주문_상태_코드() {
        assertThat(OrderStatus.CONFIRMED.getCode()).isEqualTo("confirmed");
        assertThat(OrderStatus.from("Confirmed")).isEqualTo(OrderStatus.CONFIRMED);
    }
}
