package com.purchaseflow.domain.actor;

import com.purchaseflow.domain.entity.Customer;

public record CustomerActor(Customer customer) implements Actor {

    public CustomerActor {
        if (customer == null) {
            throw new IllegalArgumentException("회원 정보는 필수입니다");
        }
    }

    @Override
    public Long getActorId() {
        return customer.getId();
    }
}
