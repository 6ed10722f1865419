package com.sparta.voicecommerce.presentation.exception;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 에러 응답 DTO
 */
public record ErrorResponse(
        @Schema(description = "에러 코드", example = "CART001")
        String code,

        @Schema(description = "에러 메시지", example = "장바구니 항목을 찾을 수 없습니다: Black Pullover Hoodie")
        String message
) {
}
