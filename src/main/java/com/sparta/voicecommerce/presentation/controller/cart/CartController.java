package com.sparta.voicecommerce.presentation.controller.cart;

import com.sparta.voicecommerce.application.cart.dto.AddToCartRequest;
import com.sparta.voicecommerce.application.cart.dto.AddToCartResponse;
import com.sparta.voicecommerce.application.cart.dto.CartItemResponse;
import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.application.cart.dto.UpdateCartItemRequest;
import com.sparta.voicecommerce.application.cart.usecase.AddToCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.ClearCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.GetCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.RemoveFromCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.UpdateCartItemUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 장바구니 관리 API
 * 장바구니는 대화 세션 단위로 존재한다
 */
@Tag(name = "장바구니 관리", description = "세션 장바구니 상품 추가/수정/삭제 API")
@RestController
@RequestMapping("/api/sessions/{sessionId}/cart")
@RequiredArgsConstructor
public class CartController {

    private final AddToCartUseCase addToCartUseCase;
    private final GetCartUseCase getCartUseCase;
    private final UpdateCartItemUseCase updateCartItemUseCase;
    private final RemoveFromCartUseCase removeFromCartUseCase;
    private final ClearCartUseCase clearCartUseCase;

    /**
     * 장바구니 조회
     * GET /api/sessions/{sessionId}/cart
     */
    @Operation(summary = "장바구니 조회", description = "세션의 장바구니를 담은 순서대로 조회합니다")
    @GetMapping
    public ResponseEntity<CartResponse> getCart(
            @Parameter(description = "세션 ID") @PathVariable String sessionId) {

        return ResponseEntity.ok(getCartUseCase.execute(sessionId));
    }

    /**
     * 장바구니 상품 추가
     * POST /api/sessions/{sessionId}/cart/items
     */
    @Operation(summary = "장바구니 상품 추가", description = "상품명으로 장바구니에 상품을 추가합니다. 같은 상품/옵션이면 수량이 합쳐집니다")
    @PostMapping("/items")
    public ResponseEntity<AddToCartResponse> addCartItem(
            @Parameter(description = "세션 ID") @PathVariable String sessionId,
            @Valid @RequestBody AddToCartRequest request) {

        return ResponseEntity.ok(addToCartUseCase.execute(sessionId, request));
    }

    /**
     * 장바구니 상품 수량 변경
     * PATCH /api/sessions/{sessionId}/cart/items
     */
    @Operation(summary = "장바구니 상품 수량 변경", description = "수량을 변경합니다. 0 이하면 항목을 삭제합니다")
    @PatchMapping("/items")
    public ResponseEntity<CartResponse> updateCartItemQuantity(
            @Parameter(description = "세션 ID") @PathVariable String sessionId,
            @Valid @RequestBody UpdateCartItemRequest request) {

        return ResponseEntity.ok(updateCartItemUseCase.execute(sessionId, request));
    }

    /**
     * 장바구니 상품 삭제
     * DELETE /api/sessions/{sessionId}/cart/items?productName=&variant=
     */
    @Operation(summary = "장바구니 상품 삭제", description = "상품명과 옵션이 정확히 일치하는 항목을 삭제합니다")
    @DeleteMapping("/items")
    public ResponseEntity<CartItemResponse> removeCartItem(
            @Parameter(description = "세션 ID") @PathVariable String sessionId,
            @Parameter(description = "상품명") @RequestParam String productName,
            @Parameter(description = "옵션 (사이즈)") @RequestParam(required = false) String variant) {

        return ResponseEntity.ok(removeFromCartUseCase.execute(sessionId, productName, variant));
    }

    /**
     * 장바구니 비우기
     * DELETE /api/sessions/{sessionId}/cart
     */
    @Operation(summary = "장바구니 비우기", description = "장바구니의 모든 항목을 삭제합니다")
    @DeleteMapping
    public ResponseEntity<Void> clearCart(
            @Parameter(description = "세션 ID") @PathVariable String sessionId) {

        clearCartUseCase.execute(sessionId);
        return ResponseEntity.noContent().build();
    }
}
