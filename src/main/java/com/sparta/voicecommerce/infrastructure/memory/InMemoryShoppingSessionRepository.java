package com.sparta.voicecommerce.infrastructure.memory;

import com.sparta.voicecommerce.domain.session.ShoppingSession;
import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 인메모리 대화 세션 Repository 구현
 * 장바구니는 세션과 함께 메모리에만 존재하며 프로세스 재시작 시 사라진다
 */
@Repository
@RequiredArgsConstructor
public class InMemoryShoppingSessionRepository implements ShoppingSessionRepository {

    private final Map<String, ShoppingSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public ShoppingSession findOrCreate(String sessionId) {
        LocalDateTime now = LocalDateTime.now(clock);
        ShoppingSession session = sessions.computeIfAbsent(sessionId, id -> ShoppingSession.start(id, now));
        session.touch(now);
        return session;
    }

    @Override
    public Optional<ShoppingSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void delete(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public int deleteIdleSince(LocalDateTime threshold) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isIdleSince(threshold));
        return before - sessions.size();
    }
}
