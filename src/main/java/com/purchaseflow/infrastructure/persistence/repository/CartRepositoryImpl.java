package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.repository.CartRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class CartRepositoryImpl implements CartRepository {

    private final JpaCartRepository jpaCartRepository;

    @Override
    public List<Cart> findByCustomerId(Long customerId) {
        return jpaCartRepository.findByCustomerIdOrderByIdAsc(customerId);
    }

    @Override
    public List<Cart> saveAll(List<Cart> carts) {
        return jpaCartRepository.saveAll(carts);
    }

    @Override
    public void deleteAll(List<Cart> carts) {
        jpaCartRepository.deleteAll(carts);
    }
}
