package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.repository.OrderRepository;
import com.purchaseflow.exception.ConcurrencyConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepository {

    private final JpaOrderRepository jpaOrderRepository;

    /**
     * 버전(@Version) 비교로 다른 요청의 선행 수정을 감지합니다.
     */
    @Override
    public Order save(Order order) {
        try {
            return jpaOrderRepository.saveAndFlush(order);
        } catch (OptimisticLockingFailureException e) {
            log.warn("주문 저장 충돌: orderId={}, version={}", order.getId(), order.getVersion());
            throw new ConcurrencyConflictException(order.getId(), e);
        }
    }

    @Override
    public Optional<Order> findById(Long id) {
        return jpaOrderRepository.findById(id);
    }
}
