package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Cart;

import java.util.List;

public interface CartRepository {

    List<Cart> findByCustomerId(Long customerId);

    List<Cart> saveAll(List<Cart> carts);

    void deleteAll(List<Cart> carts);
}
