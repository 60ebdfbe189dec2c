package com.purchaseflow.domain.actor;

import com.purchaseflow.domain.entity.Member;

public record StaffActor(Member member) implements Actor {

    public StaffActor {
        if (member == null) {
            throw new IllegalArgumentException("관리자 정보는 필수입니다");
        }
    }

    @Override
    public Long getActorId() {
        return member.getId();
    }
}
