package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaCustomerRepository extends JpaRepository<Customer, Long> {
}
