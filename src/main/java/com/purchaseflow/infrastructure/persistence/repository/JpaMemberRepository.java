package com.purchaseflow.infrastructure.persistence.repository;

import com.purchaseflow.domain.entity.Member;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JpaMemberRepository extends JpaRepository<Member, Long> {
}
