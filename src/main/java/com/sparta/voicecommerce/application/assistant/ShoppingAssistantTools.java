package com.sparta.voicecommerce.application.assistant;

import com.sparta.voicecommerce.application.cart.dto.AddToCartRequest;
import com.sparta.voicecommerce.application.cart.dto.AddToCartResponse;
import com.sparta.voicecommerce.application.cart.dto.CartItemResponse;
import com.sparta.voicecommerce.application.cart.dto.CartResponse;
import com.sparta.voicecommerce.application.cart.usecase.AddToCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.GetCartUseCase;
import com.sparta.voicecommerce.application.cart.usecase.RemoveFromCartUseCase;
import com.sparta.voicecommerce.application.order.dto.OrderCommitResponse;
import com.sparta.voicecommerce.application.order.dto.OrderItemResponse;
import com.sparta.voicecommerce.application.order.dto.OrderResponse;
import com.sparta.voicecommerce.application.order.usecase.GetLastOrderUseCase;
import com.sparta.voicecommerce.application.order.usecase.GetOrderUseCase;
import com.sparta.voicecommerce.application.order.usecase.PlaceOrderUseCase;
import com.sparta.voicecommerce.application.product.dto.ProductPageResponse;
import com.sparta.voicecommerce.application.product.dto.ProductResponse;
import com.sparta.voicecommerce.application.product.dto.ProductSearchResponse;
import com.sparta.voicecommerce.application.product.usecase.BrowseMoreProductsUseCase;
import com.sparta.voicecommerce.application.product.usecase.SearchProductsUseCase;
import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.domain.cart.exception.CartItemNotFoundException;
import com.sparta.voicecommerce.domain.cart.exception.CartQuantityExceededException;
import com.sparta.voicecommerce.domain.cart.exception.EmptyCartException;
import com.sparta.voicecommerce.domain.order.exception.OrderNotFoundException;
import com.sparta.voicecommerce.domain.product.ProductCategory;
import com.sparta.voicecommerce.domain.product.ProductSearchCondition;
import com.sparta.voicecommerce.domain.product.exception.InvalidProductCategoryException;
import com.sparta.voicecommerce.domain.product.exception.ProductNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 대화 드라이버(LLM)가 호출하는 쇼핑 도구 모음
 *
 * 모든 메서드는 단순 값만 받고 그대로 읽어줄 수 있는 영어 문장을 돌려준다.
 * BusinessException은 되묻는 문장으로 바꾸고, 예상하지 못한 예외는 ERROR로 남긴 뒤 사과 문장을 돌려준다.
 * 어떤 경우에도 예외를 드라이버로 던지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShoppingAssistantTools {

    /** 한 번에 읽어주는 상품 수 */
    public static final int PAGE_SIZE = 5;

    private static final String RUPEE = "₹";

    private final SearchProductsUseCase searchProductsUseCase;
    private final BrowseMoreProductsUseCase browseMoreProductsUseCase;
    private final AddToCartUseCase addToCartUseCase;
    private final RemoveFromCartUseCase removeFromCartUseCase;
    private final GetCartUseCase getCartUseCase;
    private final PlaceOrderUseCase placeOrderUseCase;
    private final GetLastOrderUseCase getLastOrderUseCase;
    private final GetOrderUseCase getOrderUseCase;

    /**
     * 카탈로그 검색. 처음 PAGE_SIZE개만 안내하고 나머지는 세션에 기억한다.
     */
    public String browseCatalog(String sessionId, String category, Long maxPrice, String color, String keyword) {
        log.info("browseCatalog - sessionId={}, category={}, maxPrice={}, color={}, keyword={}",
                sessionId, category, maxPrice, color, keyword);
        try {
            ProductSearchCondition condition = ProductSearchCondition.of(category, maxPrice, color, keyword);
            ProductSearchResponse result = searchProductsUseCase.execute(sessionId, condition);

            if (!result.catalogAvailable()) {
                return "Sorry, I had trouble accessing the catalog. Please try again.";
            }
            if (result.isEmpty()) {
                return "I couldn't find any products matching those criteria. "
                        + "Would you like to try different filters or browse another category?";
            }

            ProductPageResponse page = browseMoreProductsUseCase.execute(sessionId, PAGE_SIZE);
            StringBuilder response = new StringBuilder()
                    .append("I found ").append(result.count()).append(' ')
                    .append(plural(result.count(), "product")).append(":\n\n");
            appendProducts(response, page);
            return response.toString();
        } catch (InvalidProductCategoryException e) {
            return "I don't have a category called '" + e.getCategory() + "'. "
                    + "You can browse " + ProductCategory.codes() + ".";
        } catch (Exception e) {
            log.error("카탈로그 검색 실패 - sessionId={}", sessionId, e);
            return "Sorry, I had trouble accessing the catalog. Please try again.";
        }
    }

    /**
     * 마지막 검색 결과 중 아직 안내하지 않은 상품 안내
     */
    public String showMoreProducts(String sessionId) {
        log.info("showMoreProducts - sessionId={}", sessionId);
        try {
            ProductPageResponse page = browseMoreProductsUseCase.execute(sessionId, PAGE_SIZE);
            if (page.products().isEmpty()) {
                return "That's all the options I found. Would you like to try a different search?";
            }

            StringBuilder response = new StringBuilder("Here are more options:\n\n");
            appendProducts(response, page);
            return response.toString();
        } catch (Exception e) {
            log.error("추가 상품 안내 실패 - sessionId={}", sessionId, e);
            return "Sorry, I had trouble accessing the catalog. Please try again.";
        }
    }

    public String addToCart(String sessionId, String productName, int quantity, String size) {
        log.info("addToCart - sessionId={}, product={}, quantity={}, size={}", sessionId, productName, quantity, size);
        try {
            AddToCartResponse result = addToCartUseCase.execute(
                    sessionId, new AddToCartRequest(productName, quantity, size));
            CartItemResponse item = result.item();

            StringBuilder response = new StringBuilder()
                    .append("Great! I've added ").append(result.addedQuantity())
                    .append(" x ").append(item.productName()).append(' ');
            if (item.variant() != null) {
                response.append("(size ").append(item.variant()).append(") ");
            }
            int lines = result.cart().lineCount();
            response.append("to your cart for ").append(rupees(item.unitPrice() * result.addedQuantity())).append(". ")
                    .append("Your cart now has ").append(lines).append(' ').append(plural(lines, "item")).append(". ")
                    .append("Would you like to continue shopping or view your cart?");
            return response.toString();
        } catch (ProductNotFoundException e) {
            log.warn("상품명 확인 실패 - product={}", productName);
            return "I'm not sure which product you mean. Could you tell me the exact product name?";
        } catch (CartQuantityExceededException e) {
            log.warn("장바구니 수량 한도 초과 - sessionId={}, product={}, requested={}",
                    sessionId, productName, e.getRequestedQuantity());
            return "Sorry, I can only keep up to " + e.getMaxQuantity() + " of " + e.getProductName()
                    + " in your cart. Your cart hasn't changed. Would you like a smaller quantity?";
        } catch (Exception e) {
            log.error("장바구니 추가 실패 - sessionId={}, product={}", sessionId, productName, e);
            return "I'm sorry, there was an issue adding that to your cart. Could you try again?";
        }
    }

    public String removeFromCart(String sessionId, String productName, String size) {
        log.info("removeFromCart - sessionId={}, product={}, size={}", sessionId, productName, size);
        try {
            if (getCartUseCase.execute(sessionId).isEmpty()) {
                return "Your cart is empty. There's nothing to remove.";
            }

            CartItemResponse removed = removeFromCartUseCase.execute(sessionId, productName, size);
            CartResponse cart = getCartUseCase.execute(sessionId);

            StringBuilder response = new StringBuilder("I've removed ").append(removed.productName());
            if (removed.variant() != null) {
                response.append(" (size ").append(removed.variant()).append(')');
            }
            response.append(" from your cart. ");
            if (cart.isEmpty()) {
                response.append("Your cart is now empty.");
            } else {
                response.append("You now have ").append(cart.lineCount()).append(' ')
                        .append(plural(cart.lineCount(), "item")).append(" remaining in your cart.");
            }
            return response.toString();
        } catch (CartItemNotFoundException e) {
            String sized = e.getVariant() == null || e.getVariant().isBlank()
                    ? ""
                    : " in size " + e.getVariant();
            return "I couldn't find " + productName + sized + " in your cart. "
                    + "Would you like me to read your cart back to you?";
        } catch (Exception e) {
            log.error("장바구니 삭제 실패 - sessionId={}, product={}", sessionId, productName, e);
            return "I'm sorry, there was an issue removing that item. Could you try again?";
        }
    }

    public String showCart(String sessionId) {
        log.info("showCart - sessionId={}", sessionId);
        try {
            CartResponse cart = getCartUseCase.execute(sessionId);
            if (cart.isEmpty()) {
                return "Your cart is empty. Browse our products and add items to get started!";
            }

            StringBuilder response = new StringBuilder()
                    .append("Your cart has ").append(cart.lineCount()).append(' ')
                    .append(plural(cart.lineCount(), "item")).append(":\n\n");
            int number = 1;
            for (CartItemResponse item : cart.items()) {
                response.append(number++).append(". ")
                        .append(item.quantity()).append(" x ").append(item.productName());
                if (item.variant() != null) {
                    response.append(" (size ").append(item.variant()).append(')');
                }
                response.append(" - ").append(rupees(item.subtotal())).append('\n');
            }
            response.append("\nCart Total: ").append(rupees(cart.totalAmount())).append("\n\n")
                    .append("Would you like to place your order or continue shopping?");
            return response.toString();
        } catch (Exception e) {
            log.error("장바구니 조회 실패 - sessionId={}", sessionId, e);
            return "I'm sorry, I couldn't retrieve your cart right now.";
        }
    }

    /**
     * 장바구니 주문. 실패하면 장바구니는 그대로 남는다.
     */
    public String placeOrder(String sessionId) {
        log.info("placeOrder - sessionId={}", sessionId);
        try {
            if (getCartUseCase.execute(sessionId).isEmpty()) {
                return "Your cart is empty. Please add some items before placing an order.";
            }

            OrderCommitResponse result = placeOrderUseCase.execute(sessionId);
            OrderResponse order = result.order();

            StringBuilder response = new StringBuilder()
                    .append("Excellent! Your order has been placed successfully. Order ID: ")
                    .append(order.orderId()).append(".\n\n")
                    .append("Order Summary:\n");
            for (OrderItemResponse item : order.items()) {
                response.append("- ").append(item.quantity()).append(" x ").append(item.productName());
                if (item.variant() != null) {
                    response.append(" (size ").append(item.variant()).append(')');
                }
                response.append(" - ").append(rupees(item.lineTotal())).append('\n');
            }
            response.append("\nTotal Amount: ").append(rupees(order.total())).append('\n')
                    .append("Status: ").append(capitalize(order.status())).append("\n\n");
            if (result.droppedLineCount() > 0) {
                response.append("Note: ").append(String.join(", ", result.droppedProductNames()))
                        .append(result.droppedLineCount() == 1 ? " is" : " are")
                        .append(" no longer available, so I left ")
                        .append(result.droppedLineCount() == 1 ? "it" : "them")
                        .append(" out of this order.\n\n");
            }
            response.append("Thank you for your order! Is there anything else I can help you with?");
            return response.toString();
        } catch (EmptyCartException e) {
            return "None of the items in your cart are available anymore, so I couldn't place the order. "
                    + "Would you like to browse our catalog for something else?";
        } catch (Exception e) {
            log.error("주문 실패 - sessionId={}", sessionId, e);
            return "I'm sorry, there was an issue placing your order. Your cart is still saved. Please try again.";
        }
    }

    public String viewLastOrder() {
        log.info("viewLastOrder");
        try {
            Optional<OrderResponse> lastOrder = getLastOrderUseCase.execute();
            if (lastOrder.isEmpty()) {
                return "You haven't placed any orders yet. Would you like to browse our catalog?";
            }
            return "Your last order, " + describeOrder(lastOrder.get());
        } catch (Exception e) {
            log.error("최근 주문 조회 실패", e);
            return "Sorry, I couldn't retrieve your order information right now.";
        }
    }

    public String viewOrder(String orderId) {
        log.info("viewOrder - orderId={}", orderId);
        try {
            return "Your order, " + describeOrder(getOrderUseCase.execute(orderId));
        } catch (OrderNotFoundException e) {
            return "I couldn't find an order with ID " + orderId + ". Could you check the order ID?";
        } catch (BusinessException e) {
            log.warn("주문 조회 실패 - orderId={}, code={}", orderId, e.getCode());
            return "Sorry, I couldn't retrieve your order information right now.";
        } catch (Exception e) {
            log.error("주문 조회 실패 - orderId={}", orderId, e);
            return "Sorry, I couldn't retrieve your order information right now.";
        }
    }

    private void appendProducts(StringBuilder response, ProductPageResponse page) {
        int number = page.offset() + 1;
        for (ProductResponse product : page.products()) {
            response.append(number++).append(". ").append(product.name()).append('\n')
                    .append("   Price: ").append(rupees(product.price())).append('\n');
            if (!product.description().isEmpty()) {
                response.append("   ").append(product.description()).append('\n');
            }
            if (product.color() != null && !product.color().isBlank()) {
                response.append("   Color: ").append(product.color()).append('\n');
            }
            if (isApparel(product) && !product.sizes().isEmpty()) {
                response.append("   Sizes: ").append(String.join(", ", product.sizes())).append('\n');
            }
            response.append('\n');
        }
        if (page.remainingCount() > 0) {
            response.append("I have ").append(page.remainingCount())
                    .append(" more options. Would you like to hear about them?");
        }
    }

    private String describeOrder(OrderResponse order) {
        StringBuilder response = new StringBuilder()
                .append("Order ID ").append(order.orderId())
                .append(", was placed on ").append(order.createdAt().toLocalDate()).append(". ")
                .append("You ordered: ");
        List<OrderItemResponse> items = order.items();
        for (int i = 0; i < items.size(); i++) {
            OrderItemResponse item = items.get(i);
            if (i > 0) {
                response.append("and ");
            }
            response.append(item.quantity()).append(' ').append(item.productName()).append(' ');
            if (item.variant() != null) {
                response.append("in size ").append(item.variant()).append(' ');
            }
            response.append("for ").append(item.lineTotal()).append(" rupees, ");
        }
        response.append("Total amount: ").append(order.total()).append(" rupees. ")
                .append("Status: ").append(order.status()).append('.');
        return response.toString();
    }

    private static boolean isApparel(ProductResponse product) {
        try {
            return ProductCategory.from(product.category()).isApparel();
        } catch (InvalidProductCategoryException e) {
            return false;
        }
    }

    private static String rupees(long amount) {
        return RUPEE + amount;
    }

    private static String plural(int count, String noun) {
        return count == 1 ? noun : noun + "s";
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
