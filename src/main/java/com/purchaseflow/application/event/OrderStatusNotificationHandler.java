package com.purchaseflow.application.event;

import com.purchaseflow.infrastructure.external.OrderMailSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 상태 변경 알림 핸들러
 *
 * - AFTER_COMMIT: 주문이 실제로 저장된 경우에만 발송
 * - Best Effort: 발송 실패는 로그로만 남기고 주문 처리에는 영향을 주지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStatusNotificationHandler {

    static final String TEMPLATE_ORDER_RECEIVED = "order-received";
    static final String TEMPLATE_STATUS_CHANGED = "order-status-changed";

    private final OrderMailSender orderMailSender;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(OrderStatusChangedEvent event) {
        Long orderId = event.order().getId();
        String template = event.isNewOrder() ? TEMPLATE_ORDER_RECEIVED : TEMPLATE_STATUS_CHANGED;

        try {
            if (!orderMailSender.send(orderId, template)) {
                log.warn("주문 알림 발송 실패: orderId={}, template={}", orderId, template);
            }
        } catch (Exception e) {
            log.error("주문 알림 발송 중 예외 발생: orderId={}, template={}", orderId, template, e);
        }
    }
}
