package com.sparta.voicecommerce.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 상점 설정 (application.yml의 shop.*)
 *
 * @param catalog 상품 카탈로그 위치
 * @param ledger  주문 원장 파일 위치
 * @param session 대화 세션 유지 정책
 */
@ConfigurationProperties(prefix = "shop")
public record ShopProperties(
        Catalog catalog,
        Ledger ledger,
        Session session
) {

    public ShopProperties {
        catalog = catalog == null ? new Catalog(null) : catalog;
        ledger = ledger == null ? new Ledger(null) : ledger;
        session = session == null ? new Session(null, null) : session;
    }

    /**
     * @param location Spring Resource 경로 (classpath:, file: 모두 가능)
     */
    public record Catalog(String location) {
        public Catalog {
            location = (location == null || location.isBlank()) ? "classpath:catalog/products.json" : location;
        }
    }

    /**
     * @param path 주문 원장 JSON 파일 경로
     */
    public record Ledger(String path) {
        public Ledger {
            path = (path == null || path.isBlank()) ? "./data/orders.json" : path;
        }
    }

    /**
     * @param idleTimeout     이 시간 동안 사용되지 않은 세션은 정리 대상
     * @param cleanupInterval 정리 작업 주기
     */
    public record Session(Duration idleTimeout, Duration cleanupInterval) {
        public Session {
            idleTimeout = idleTimeout == null ? Duration.ofHours(2) : idleTimeout;
            cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(10) : cleanupInterval;
        }
    }
}
