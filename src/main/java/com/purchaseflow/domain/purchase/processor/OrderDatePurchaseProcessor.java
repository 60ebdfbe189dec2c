package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.entity.OrderStatusType;
import com.purchaseflow.domain.entity.Shipping;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.service.OrderStatusResolver;
import com.purchaseflow.domain.vo.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 주문 일자 갱신
 *
 * 신규 주문:
 * - 주문일을 기록한다
 * - 발송 완료 상태면 발송일과 모든 배송지의 발송일을 같은 시각으로 기록한다
 * - 그렇지 않고 입금 완료 상태면 입금일을 기록한다
 *
 * 주문 편집:
 * - 편집 전과 상태가 다를 때만 발송일/입금일을 기록한다 (같은 상태로 다시 저장해도 값이 바뀌지 않는다)
 * - 주문일은 건드리지 않는다
 * - 발송 완료 → 입금 완료로 되돌린 경우 입금일만 기록하고 기존 발송일은 그대로 둔다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderDatePurchaseProcessor extends AbstractOrderProcessor {

    private final OrderStatusResolver statusResolver;
    private final Clock clock;

    @Override
    protected void processOrder(Order target, PurchaseContext context) {
        LocalDateTime now = LocalDateTime.now(clock);
        OrderStatus delivered = statusResolver.resolve(OrderStatusType.DELIVERED);
        OrderStatus paid = statusResolver.resolve(OrderStatusType.PAID);
        OrderStatus status = target.getOrderStatus();

        if (context.isNew()) {
            if (status.equals(delivered)) {
                stampCommitDate(target, now);
            } else if (status.equals(paid)) {
                target.stampPaymentDate(now);
            }
            target.stampOrderDate(now);
            return;
        }

        Order origin = requireOrder(context.getOriginHolder());
        if (status.equals(origin.getOrderStatus())) {
            return;
        }
        if (status.equals(delivered)) {
            stampCommitDate(target, now);
        } else if (status.equals(paid)) {
            target.stampPaymentDate(now);
        }
    }

    private void stampCommitDate(Order target, LocalDateTime now) {
        target.stampCommitDate(now);
        for (Shipping shipping : target.getShippings()) {
            shipping.stampShippingCommitDate(now);
        }
        log.debug("발송일 기록: orderId={}, shippings={}", target.getId(), target.getShippings().size());
    }
}
