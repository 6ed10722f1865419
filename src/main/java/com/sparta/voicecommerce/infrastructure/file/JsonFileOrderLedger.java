package com.sparta.voicecommerce.infrastructure.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.voicecommerce.common.exception.PersistenceException;
import com.sparta.voicecommerce.domain.order.Order;
import com.sparta.voicecommerce.domain.order.OrderLedger;
import com.sparta.voicecommerce.infrastructure.file.document.OrderDocument;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * JSON 파일 기반 주문 원장
 *
 * 파일 전체가 주문 배열 하나이며, 추가할 때마다 전체를 다시 쓴다.
 * - 파일이 없으면 빈 원장
 * - 배열이 아닌 JSON이면 빈 원장으로 취급 (WARN)
 * - 쓰기는 같은 디렉토리의 임시 파일에 쓴 뒤 원자적으로 교체한다
 *
 * 읽기-ID 부여-추가-쓰기는 프로세스 내 단일 락 안에서 수행된다.
 */
@Slf4j
public class JsonFileOrderLedger implements OrderLedger {

    private static final TypeReference<List<OrderDocument>> ORDER_LIST = new TypeReference<>() {
    };

    private final Path ledgerPath;
    private final ObjectMapper objectMapper;
    private final Object ledgerLock = new Object();

    public JsonFileOrderLedger(Path ledgerPath, ObjectMapper objectMapper) {
        this.ledgerPath = ledgerPath.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Order> findAll() {
        synchronized (ledgerLock) {
            return readOrders();
        }
    }

    @Override
    public Optional<Order> findLast() {
        List<Order> orders = findAll();
        return orders.isEmpty() ? Optional.empty() : Optional.of(orders.get(orders.size() - 1));
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return findAll().stream()
                .filter(order -> order.getOrderId().equals(orderId))
                .findFirst();
    }

    @Override
    public Order append(Function<List<Order>, Order> orderCreator) {
        synchronized (ledgerLock) {
            List<Order> orders = readOrders();
            Order created = orderCreator.apply(orders);

            List<Order> updated = new ArrayList<>(orders);
            updated.add(created);
            writeOrders(updated);

            log.debug("주문 원장 기록 완료 - orderId={}, ledgerSize={}", created.getOrderId(), updated.size());
            return created;
        }
    }

    private List<Order> readOrders() {
        if (!Files.exists(ledgerPath)) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(ledgerPath.toFile());
        } catch (IOException e) {
            throw new PersistenceException("주문 원장을 읽을 수 없습니다: " + ledgerPath, e);
        }
        if (root == null || !root.isArray()) {
            log.warn("주문 원장이 배열 형식이 아니므로 빈 원장으로 취급합니다: {}", ledgerPath);
            return List.of();
        }

        try {
            List<OrderDocument> documents = objectMapper.convertValue(root, ORDER_LIST);
            List<Order> orders = new ArrayList<>(documents.size());
            for (OrderDocument document : documents) {
                Order order = document.toDomain();
                if (order.getTotal() != document.total()) {
                    log.warn("주문 합계가 항목 합계와 다릅니다 - orderId={}, recorded={}, computed={}",
                            document.id(), document.total(), order.getTotal());
                }
                orders.add(order);
            }
            return orders;
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("주문 원장 형식이 올바르지 않습니다: " + ledgerPath, e);
        }
    }

    private void writeOrders(List<Order> orders) {
        List<OrderDocument> documents = orders.stream()
                .map(OrderDocument::from)
                .toList();

        Path directory = ledgerPath.getParent();
        Path tempFile = null;
        try {
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, ledgerPath.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tempFile.toFile(), documents);
            moveIntoPlace(tempFile);
            tempFile = null;
        } catch (IOException e) {
            throw new PersistenceException("주문 원장 저장에 실패했습니다: " + ledgerPath, e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, ledgerPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("원자적 이동을 지원하지 않는 파일 시스템입니다. 일반 교체로 진행합니다: {}", ledgerPath);
            Files.move(tempFile, ledgerPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("임시 원장 파일 삭제 실패: {}", tempFile, e);
        }
    }
}
