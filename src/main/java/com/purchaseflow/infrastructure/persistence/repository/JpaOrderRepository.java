package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Order;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaOrderRepository extends JpaRepository<Order, Long> {
}
