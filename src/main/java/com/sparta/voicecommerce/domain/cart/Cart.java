package com.sparta.voicecommerce.domain.cart;

import com.sparta.voicecommerce.domain.cart.exception.CartItemNotFoundException;
import com.sparta.voicecommerce.domain.product.Product;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 장바구니
 * 하나의 대화 세션이 단독으로 소유하며 메모리에만 존재한다.
 * 항목은 담은 순서를 유지하고, 수량이 0이 된 항목은 남기지 않는다.
 */
public class Cart {

    private final List<CartItem> items = new ArrayList<>();

    /**
     * 장바구니에 상품 추가
     * 같은 슬롯(상품 + 옵션)이 이미 있으면 수량을 더하고, 없으면 맨 뒤에 추가한다.
     * 0 이하의 수량은 1로 보정한다.
     *
     * @return 추가/갱신된 항목
     * @throws com.sparta.voicecommerce.domain.cart.exception.CartQuantityExceededException 합산 수량이 최대 수량을 넘는 경우 (장바구니는 그대로)
     */
    public CartItem addItem(Product product, int quantity, String variant) {
        int normalizedQuantity = Math.max(quantity, CartConstants.MIN_QUANTITY);

        for (int i = 0; i < items.size(); i++) {
            CartItem existing = items.get(i);
            if (existing.isSameSlot(product.getProductId(), variant)) {
                CartItem updated = existing.addQuantity(normalizedQuantity);
                items.set(i, updated);
                return updated;
            }
        }

        CartItem newItem = CartItem.of(product, normalizedQuantity, variant);
        items.add(newItem);
        return newItem;
    }

    /**
     * 상품명 + 옵션이 정확히 일치하는 첫 항목 삭제
     * 옵션이 다른 항목은 절대 대신 삭제하지 않는다.
     *
     * @return 삭제된 항목
     * @throws CartItemNotFoundException 일치하는 항목이 없는 경우
     */
    public CartItem removeItem(String productName, String variant) {
        int index = indexOf(productName, variant)
                .orElseThrow(() -> new CartItemNotFoundException(productName, variant));
        return items.remove(index);
    }

    /**
     * 항목 수량 변경. 0 이하면 항목을 삭제한다.
     *
     * @return 변경된 항목 (삭제된 경우 empty)
     * @throws CartItemNotFoundException 일치하는 항목이 없는 경우
     */
    public Optional<CartItem> updateQuantity(String productName, String variant, int newQuantity) {
        int index = indexOf(productName, variant)
                .orElseThrow(() -> new CartItemNotFoundException(productName, variant));

        if (newQuantity < CartConstants.MIN_QUANTITY) {
            items.remove(index);
            return Optional.empty();
        }

        CartItem updated = items.get(index).updateQuantity(newQuantity);
        items.set(index, updated);
        return Optional.of(updated);
    }

    /**
     * 장바구니 비우기
     */
    public void clear() {
        items.clear();
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    /**
     * 총 상품 개수
     */
    public int getTotalItemCount() {
        return items.stream()
                .mapToInt(CartItem::getQuantity)
                .sum();
    }

    /**
     * 담은 시점 가격 기준 합계 (안내용, 주문 금액은 주문 시점에 다시 계산)
     */
    public long getTotalAmount() {
        return items.stream()
                .mapToLong(CartItem::getSubtotal)
                .sum();
    }

    private Optional<Integer> indexOf(String productName, String variant) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).matches(productName, variant)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
