package com.sparta.voicecommerce.presentation.controller.order;

import com.sparta.voicecommerce.application.order.dto.CreateOrderRequest;
import com.sparta.voicecommerce.application.order.dto.OrderCommitResponse;
import com.sparta.voicecommerce.application.order.dto.OrderResponse;
import com.sparta.voicecommerce.application.order.usecase.CreateOrderUseCase;
import com.sparta.voicecommerce.application.order.usecase.GetLastOrderUseCase;
import com.sparta.voicecommerce.application.order.usecase.GetOrderUseCase;
import com.sparta.voicecommerce.application.order.usecase.GetOrdersUseCase;
import com.sparta.voicecommerce.application.order.usecase.PlaceOrderUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 주문 관리 API
 */
@Tag(name = "주문 관리", description = "주문 생성 및 조회 API")
@RestController
@RequiredArgsConstructor
public class OrderController {

    private final PlaceOrderUseCase placeOrderUseCase;
    private final CreateOrderUseCase createOrderUseCase;
    private final GetOrdersUseCase getOrdersUseCase;
    private final GetLastOrderUseCase getLastOrderUseCase;
    private final GetOrderUseCase getOrderUseCase;

    /**
     * 장바구니 주문
     * POST /api/sessions/{sessionId}/orders
     */
    @Operation(summary = "장바구니 주문", description = "세션 장바구니를 주문으로 확정합니다. 성공하면 장바구니가 비워집니다")
    @PostMapping("/api/sessions/{sessionId}/orders")
    public ResponseEntity<OrderCommitResponse> placeOrder(
            @Parameter(description = "세션 ID") @PathVariable String sessionId) {

        return ResponseEntity.status(HttpStatus.CREATED).body(placeOrderUseCase.execute(sessionId));
    }

    /**
     * 주문 항목 직접 지정 주문
     * POST /api/orders
     */
    @Operation(summary = "주문 생성", description = "상품명/수량/옵션 목록으로 주문을 생성합니다")
    @PostMapping("/api/orders")
    public ResponseEntity<OrderCommitResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(createOrderUseCase.execute(request));
    }

    /**
     * 주문 이력 조회
     * GET /api/orders
     */
    @Operation(summary = "주문 이력 조회", description = "원장에 기록된 순서대로 모든 주문을 조회합니다")
    @GetMapping("/api/orders")
    public ResponseEntity<List<OrderResponse>> getOrders() {
        return ResponseEntity.ok(getOrdersUseCase.execute());
    }

    /**
     * 최근 주문 조회
     * GET /api/orders/last
     */
    @Operation(summary = "최근 주문 조회", description = "가장 최근 주문을 조회합니다. 주문이 없으면 204를 반환합니다")
    @GetMapping("/api/orders/last")
    public ResponseEntity<OrderResponse> getLastOrder() {
        return getLastOrderUseCase.execute()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * 주문 상세 조회
     * GET /api/orders/{orderId}
     */
    @Operation(summary = "주문 상세 조회", description = "주문 ID로 주문을 조회합니다")
    @GetMapping("/api/orders/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @Parameter(description = "주문 ID") @PathVariable String orderId) {

        return ResponseEntity.ok(getOrderUseCase.execute(orderId));
    }
}
