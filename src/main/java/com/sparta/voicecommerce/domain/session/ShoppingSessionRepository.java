package com.sparta.voicecommerce.domain.session;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 대화 세션 저장소 인터페이스
 */
public interface ShoppingSessionRepository {

    /**
     * 세션 조회 또는 생성. 조회할 때마다 마지막 접근 시각을 갱신한다.
     */
    ShoppingSession findOrCreate(String sessionId);

    Optional<ShoppingSession> findById(String sessionId);

    void delete(String sessionId);

    /**
     * 기준 시각 이전부터 사용되지 않은 세션 삭제
     * @return 삭제된 세션 수
     */
    int deleteIdleSince(LocalDateTime threshold);
}
