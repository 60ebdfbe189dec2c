package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Member;

import java.util.Optional;

public interface MemberRepository {

    Member save(Member member);

    Optional<Member> findById(Long id);
}
