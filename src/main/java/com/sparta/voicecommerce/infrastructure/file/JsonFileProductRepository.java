package com.sparta.voicecommerce.infrastructure.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.voicecommerce.common.exception.BusinessException;
import com.sparta.voicecommerce.domain.order.OrderConstants;
import com.sparta.voicecommerce.domain.product.Product;
import com.sparta.voicecommerce.domain.product.ProductCategory;
import com.sparta.voicecommerce.domain.product.ProductRepository;
import com.sparta.voicecommerce.domain.product.exception.CatalogUnavailableException;
import com.sparta.voicecommerce.infrastructure.file.document.ProductDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JSON 파일 기반 상품 카탈로그
 *
 * 첫 조회 시 한 번만 읽어서 캐시한다. 읽기에 실패하면 캐시하지 않고 다음 조회에서 다시 시도한다.
 * 로드 이후에는 읽기 전용이므로 여러 세션이 그대로 공유한다.
 */
@Slf4j
public class JsonFileProductRepository implements ProductRepository {

    private static final TypeReference<List<ProductDocument>> PRODUCT_LIST = new TypeReference<>() {
    };

    private final Resource catalogResource;
    private final ObjectMapper objectMapper;
    private final Object loadLock = new Object();

    private volatile List<Product> products;

    public JsonFileProductRepository(Resource catalogResource, ObjectMapper objectMapper) {
        this.catalogResource = catalogResource;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Product> findAll() {
        List<Product> loaded = products;
        if (loaded != null) {
            return loaded;
        }
        synchronized (loadLock) {
            if (products == null) {
                products = load();
            }
            return products;
        }
    }

    @Override
    public Optional<Product> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return findAll().stream()
                .filter(product -> product.getName().equals(name))
                .findFirst();
    }

    private List<Product> load() {
        if (!catalogResource.exists()) {
            log.warn("상품 카탈로그 파일이 없습니다: {}", catalogResource.getDescription());
            throw new CatalogUnavailableException("상품 카탈로그 파일이 없습니다: " + catalogResource.getDescription());
        }

        List<ProductDocument> documents;
        try (InputStream in = catalogResource.getInputStream()) {
            documents = objectMapper.readValue(in, PRODUCT_LIST);
        } catch (IOException e) {
            log.warn("상품 카탈로그 파싱 실패: {} - {}", catalogResource.getDescription(), e.getMessage());
            throw new CatalogUnavailableException("상품 카탈로그를 읽을 수 없습니다: " + e.getMessage(), e);
        }
        if (documents == null) {
            throw new CatalogUnavailableException("상품 카탈로그가 비어 있습니다: " + catalogResource.getDescription());
        }

        List<Product> loaded = new ArrayList<>(documents.size());
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (ProductDocument document : documents) {
            Product product = toProduct(document);
            if (!ids.add(product.getProductId())) {
                throw new CatalogUnavailableException("중복된 상품 ID가 있습니다: " + product.getProductId());
            }
            if (!names.add(product.getName())) {
                throw new CatalogUnavailableException("중복된 상품명이 있습니다: " + product.getName());
            }
            loaded.add(product);
        }

        log.info("상품 카탈로그 로드 완료 - {}개 ({})", loaded.size(), catalogResource.getDescription());
        return List.copyOf(loaded);
    }

    private Product toProduct(ProductDocument document) {
        if (document == null || isBlank(document.id()) || isBlank(document.name())) {
            throw new CatalogUnavailableException("상품 ID와 상품명은 필수입니다: " + document);
        }
        if (document.price() == null) {
            throw new CatalogUnavailableException("상품 가격이 없습니다: " + document.id());
        }
        if (document.currency() != null && !OrderConstants.CURRENCY.equals(document.currency())) {
            throw new CatalogUnavailableException(
                    "지원하지 않는 통화입니다 (" + document.id() + "): " + document.currency());
        }
        try {
            return Product.builder()
                    .productId(document.id())
                    .name(document.name())
                    .category(ProductCategory.from(document.category()))
                    .price(document.price())
                    .color(document.color())
                    .description(document.description())
                    .attributes(document.attributes())
                    .build();
        } catch (BusinessException | IllegalArgumentException e) {
            throw new CatalogUnavailableException("잘못된 상품 데이터입니다 (" + document.id() + "): " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
