package com.sparta.voicecommerce.domain.order.service;

import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.cart.exception.EmptyCartException;
import com.sparta.voicecommerce.domain.order.Order;
import com.sparta.voicecommerce.domain.order.OrderCommitResult;
import com.sparta.voicecommerce.domain.order.OrderConstants;
import com.sparta.voicecommerce.domain.order.OrderItem;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import com.sparta.voicecommerce.domain.order.OrderLineCommand;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 주문 생성 도메인 서비스
 *
 * 주문 흐름:
 * 1. 요청 항목을 상품명으로 현재 카탈로그에서 다시 조회 (가격은 주문 시점 기준)
 * 2. 찾을 수 없는 항목은 제외하고 개수를 결과에 담는다
 * 3. 원장 임계 구역 안에서 주문 ID 부여 후 저장
 *
 * 남은 항목이 하나도 없으면 원장을 건드리지 않고 EmptyCartException을 던진다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderFactory {

    private final ProductRepository productRepository;
    private final OrderLedger orderLedger;
    private final Clock clock;

    /**
     * 장바구니 전체를 주문으로 확정
     * 장바구니 자체는 변경하지 않는다 (비우는 것은 호출자 책임)
     */
    public OrderCommitResult commit(Cart cart) {
        List<OrderLineCommand> lines = cart.getItems().stream()
                .map(OrderLineCommand::from)
                .toList();
        return commit(lines);
    }

    /**
     * 주문 요청 항목 목록을 주문으로 확정
     *
     * @throws EmptyCartException 요청 항목이 없거나 모두 카탈로그에서 찾을 수 없는 경우
     * @throws com.sparta.voicecommerce.common.exception.PersistenceException 원장 저장 실패
     */
    public OrderCommitResult commit(List<OrderLineCommand> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new EmptyCartException("주문할 항목이 없습니다");
        }

        List<OrderItem> orderItems = new ArrayList<>();
        List<String> droppedProductNames = new ArrayList<>();
        for (OrderLineCommand line : lines) {
            Optional<Product> product = resolve(line.productName());
            if (product.isPresent()) {
                orderItems.add(OrderItem.of(product.get(), line.quantity(), line.variant()));
            } else {
                droppedProductNames.add(line.productName());
            }
        }

        if (!droppedProductNames.isEmpty()) {
            log.warn("카탈로그에서 찾을 수 없는 주문 항목 제외 - count={}, products={}",
                    droppedProductNames.size(), droppedProductNames);
        }
        if (orderItems.isEmpty()) {
            throw new EmptyCartException("주문 가능한 항목이 없습니다. 제외된 항목: " + droppedProductNames.size() + "개");
        }

        LocalDateTime createdAt = LocalDateTime.now(clock);
        Order order = orderLedger.append(existingOrders ->
                Order.confirm(OrderConstants.nextOrderId(existingOrders.size()), orderItems, createdAt));

        log.info("주문 확정 - orderId={}, items={}, total={} {}",
                order.getOrderId(), order.getItemCount(), order.getTotal(), order.getCurrency());

        return new OrderCommitResult(order, droppedProductNames);
    }

    private Optional<Product> resolve(String productName) {
        try {
            return productRepository.findByName(productName);
        } catch (CatalogUnavailableException e) {
            log.warn("카탈로그를 불러올 수 없어 주문 항목을 제외합니다 - product={}, reason={}",
                    productName, e.getMessage());
            return Optional.empty();
        }
    }
}
