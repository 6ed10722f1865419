package com.sparta.voicecommerce.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.infrastructure.file.JsonFileOrderLedger;
import com.sparta.voicecommerce.infrastructure.file.JsonFileProductRepository;
import com.sparta.voicecommerce.infrastructure.file.StoreJsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 카탈로그/주문 원장 저장소와 공용 빈 설정
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(ShopProperties.class)
public class ShopConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProductRepository productRepository(ShopProperties properties, ResourceLoader resourceLoader) {
        String location = properties.catalog().location();
        log.info("상품 카탈로그 위치: {}", location);
        return new JsonFileProductRepository(resourceLoader.getResource(location), storeObjectMapper());
    }

    @Bean
    public OrderLedger orderLedger(ShopProperties properties) {
        Path path = Path.of(properties.ledger().path());
        log.info("주문 원장 위치: {}", path.toAbsolutePath());
        return new JsonFileOrderLedger(path, storeObjectMapper());
    }

    private ObjectMapper storeObjectMapper() {
        return StoreJsonMapper.create();
    }
}
