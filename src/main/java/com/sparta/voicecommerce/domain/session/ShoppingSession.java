package com.sparta.voicecommerce.domain.session;

import com.sparta.voicecommerce.domain.cart.Cart;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductCategory;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 대화 세션 상태
 * 장바구니와 대화 맥락(마지막으로 안내한 검색 결과)을 세션 단위로 묶는다.
 * 한 세션에 대한 호출은 대화 드라이버가 한 턴씩 직렬화해서 보낸다.
 */
@Getter
public class ShoppingSession {

    private final String sessionId;
    private final Cart cart = new Cart();
    private final LocalDateTime createdAt;
    private LocalDateTime lastAccessedAt;

    private List<Product> lastProductsShown = List.of();
    private int presentedCount;
    private ProductCategory currentCategory;

    private ShoppingSession(String sessionId, LocalDateTime now) {
        this.sessionId = sessionId;
        this.createdAt = now;
        this.lastAccessedAt = now;
    }

    public static ShoppingSession start(String sessionId, LocalDateTime now) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("세션 ID는 필수입니다");
        }
        return new ShoppingSession(sessionId, now);
    }

    public void touch(LocalDateTime now) {
        this.lastAccessedAt = now;
    }

    /**
     * 검색 결과를 기억한다. 아직 아무것도 안내하지 않은 상태로 초기화된다.
     */
    public void rememberSearch(List<Product> products, ProductCategory category) {
        this.lastProductsShown = List.copyOf(products);
        this.presentedCount = 0;
        if (category != null) {
            this.currentCategory = category;
        }
    }

    /**
     * 아직 안내하지 않은 다음 상품들을 꺼내고 안내한 위치를 옮긴다
     */
    public List<Product> nextProducts(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("페이지 크기는 1 이상이어야 합니다");
        }
        int from = presentedCount;
        int to = Math.min(lastProductsShown.size(), from + pageSize);
        presentedCount = to;
        return lastProductsShown.subList(from, to);
    }

    public int getRemainingProductCount() {
        return lastProductsShown.size() - presentedCount;
    }

    public boolean isIdleSince(LocalDateTime threshold) {
        return lastAccessedAt.isBefore(threshold);
    }
}
