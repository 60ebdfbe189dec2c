package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Customer;

import java.util.Optional;

public interface CustomerRepository {

    Customer save(Customer customer);

    Optional<Customer> findById(Long id);
}
