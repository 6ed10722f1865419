package com.sparta.voicecommerce.application.order.dto;

import com.sparta.voicecommerce.domain.order.OrderCommitResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 주문 생성 응답
 * 카탈로그에서 사라져 제외된 항목이 있으면 함께 알려준다
 */
public record OrderCommitResponse(
        @Schema(description = "생성된 주문")
        OrderResponse order,

        @Schema(description = "제외된 항목 수", example = "0")
        int droppedLineCount,

        @Schema(description = "제외된 상품명 목록")
        List<String> droppedProductNames
) {
    public static OrderCommitResponse from(OrderCommitResult result) {
        return new OrderCommitResponse(
                OrderResponse.from(result.order()),
                result.droppedLineCount(),
                result.droppedProductNames()
        );
    }
}
