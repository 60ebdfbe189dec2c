package com.purchaseflow.application.event;

import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.entity.OrderStatusType;
import com.purchaseflow.domain.vo.OrderStatus;

/**
 * 주문 상태 변경 이벤트
 *
 * 신규 주문은 previousStatus가 null입니다.
 * 신규 주문의 ID는 저장 후에 할당되므로 주문 자체를 참조로 전달하고,
 * 핸들러는 트랜잭션 커밋 이후(AFTER_COMMIT)에 ID를 읽습니다.
 */
public record OrderStatusChangedEvent(
        Order order,
        OrderStatus previousStatus,
        OrderStatus currentStatus,
        OrderStatusType meaning
) {
    public boolean isNewOrder() {
        return previousStatus == null;
    }
}
