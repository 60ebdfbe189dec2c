package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.application.event.DomainEventPublisher;
import com.purchaseflow.application.event.OrderStatusChangedEvent;
import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.service.OrderStatusResolver;
import com.purchaseflow.domain.vo.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 신규 주문 또는 상태가 바뀐 주문에 대해 알림 이벤트를 발행합니다.
 * 실제 발송은 트랜잭션 커밋 이후 이벤트 핸들러가 처리합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusNotificationProcessor extends AbstractOrderProcessor {

    private final DomainEventPublisher eventPublisher;
    private final OrderStatusResolver statusResolver;

    @Override
    protected void processOrder(Order target, PurchaseContext context) {
        OrderStatus previous = null;
        if (!context.isNew()) {
            previous = requireOrder(context.getOriginHolder()).getOrderStatus();
            if (target.getOrderStatus().equals(previous)) {
                return;
            }
        }

        OrderStatusChangedEvent event = new OrderStatusChangedEvent(
                target,
                previous,
                target.getOrderStatus(),
                statusResolver.meaningOf(target.getOrderStatus()).orElse(null)
        );
        eventPublisher.publish(event);
        log.debug("주문 상태 변경 이벤트 발행: orderId={}, {} -> {}", target.getId(), previous, target.getOrderStatus());
    }
}
