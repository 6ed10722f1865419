package com.sparta.voicecommerce.infrastructure.memory;

import com.sparta.voicecommerce.domain.session.ShoppingSessionRepository;
import com.sparta.voicecommerce.infrastructure.config.ShopProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 오래 사용되지 않은 대화 세션을 정리하는 Scheduler
 * 세션이 정리되면 담겨 있던 장바구니도 함께 사라진다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShoppingSessionCleaner {

    private final ShoppingSessionRepository sessionRepository;
    private final ShopProperties shopProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${shop.session.cleanup-interval:PT10M}")
    public void evictIdleSessions() {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(shopProperties.session().idleTimeout());
        int evicted = sessionRepository.deleteIdleSince(threshold);

        if (evicted > 0) {
            log.info("유휴 세션 정리 완료 - {}건 (기준: {} 이전)", evicted, threshold);
        }
    }
}
