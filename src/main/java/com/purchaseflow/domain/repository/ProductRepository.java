package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Product;

import java.util.Optional;

public interface ProductRepository {

    Product save(Product product);

    Optional<Product> findById(Long id);
}
