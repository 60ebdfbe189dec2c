package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Cart;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaCartRepository extends JpaRepository<Cart, Long> {
    List<Cart> findByCustomerIdOrderByIdAsc(Long customerId);
}
