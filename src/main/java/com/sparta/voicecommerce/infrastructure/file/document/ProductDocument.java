package com.sparta.voicecommerce.infrastructure.file.document;

import java.util.Map;

/**
 * 카탈로그 파일의 상품 한 건
 * <pre>
 * {"id": "hoodie-01", "name": "Black Pullover Hoodie", "price": 1800, "category": "hoodie",
 *  "color": "black", "description": "...", "attributes": {"sizes": ["S", "M"]}}
 * </pre>
 * currency는 생략할 수 있으며, 적혀 있으면 주문 통화(INR)와 같아야 한다
 */
public record ProductDocument(
        String id,
        String name,
        String description,
        Long price,
        String currency,
        String category,
        String color,
        Map<String, Object> attributes
) {
}
