package com.purchaseflow.domain.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 주문 상태의 의미
 *
 * 실제 상태 ID는 purchase-flow.order-status.{key} 설정으로 결정됩니다.
 */
@Getter
@RequiredArgsConstructor
public enum OrderStatusType {
    NEW("new"),                 // 신규 접수
    CANCEL("cancel"),           // 취소
    IN_PROGRESS("in-progress"), // 처리 중
    DELIVERED("delivered"),     // 발송 완료
    PAID("paid"),               // 입금 완료
    PENDING("pending"),         // 결제 처리 중
    PROCESSING("processing"),   // 구매 처리 중
    RETURNED("returned");       // 반품

    private final String key;
}
