package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.BusinessException;

import java.util.Optional;

public interface OrderRepository {

    /**
     * @throws com.purchaseflow.exception.ConcurrencyConflictException 다른 요청이 먼저 수정한 주문인 경우
     */
    Order save(Order order);

    Optional<Order> findById(Long id);

    default Order getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> new BusinessException(ResponseCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다: " + id));
    }
}
