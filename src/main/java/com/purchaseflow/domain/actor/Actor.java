package com.purchaseflow.domain.actor;

/**
 * 구매 플로우를 실행하는 인증된 주체
 *
 * 관리자(StaffActor) 또는 회원(CustomerActor) 중 하나입니다.
 */
public sealed interface Actor permits StaffActor, CustomerActor {

    Long getActorId();
}
