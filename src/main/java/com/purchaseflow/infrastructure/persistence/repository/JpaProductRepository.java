package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaProductRepository extends JpaRepository<Product, Long> {
}
