package com.sparta.voicecommerce.domain.order;

import java.util.List;

/**
 * 주문 커밋 결과
 * 카탈로그에서 더 이상 찾을 수 없어 제외된 항목을 함께 알려준다
 */
public record OrderCommitResult(
        Order order,
        List<String> droppedProductNames
) {
    public OrderCommitResult {
        droppedProductNames = List.copyOf(droppedProductNames);
    }

    public int droppedLineCount() {
        return droppedProductNames.size();
    }

    public boolean hasDroppedLines() {
        return !droppedProductNames.isEmpty();
    }
}
