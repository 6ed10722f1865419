package com.sparta.voicecommerce.presentation.controller.session;

import com.sparta.voicecommerce.application.session.usecase.EndSessionUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 대화 세션 API
 */
@Tag(name = "대화 세션", description = "대화 세션 종료 API")
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final EndSessionUseCase endSessionUseCase;

    /**
     * 대화 종료
     * DELETE /api/sessions/{sessionId}
     */
    @Operation(summary = "대화 종료", description = "세션과 주문되지 않은 장바구니를 삭제합니다")
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> endSession(
            @Parameter(description = "세션 ID") @PathVariable String sessionId) {

        endSessionUseCase.execute(sessionId);
        return ResponseEntity.noContent().build();
    }
}
