package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.vo.Money;
import org.springframework.stereotype.Component;

/**
 * 상품 합계와 결제 금액(상품 합계 - 사용 포인트)을 다시 계산합니다.
 */
@Component
public class OrderTotalCalculator extends AbstractOrderProcessor {

    @Override
    protected void processOrder(Order target, PurchaseContext context) {
        Money subtotal = target.getItemsTotal();
        Money paymentTotal = subtotal.subtractOrZero(Money.of(Math.max(0, target.getUsePoint())));
        target.applyTotals(subtotal, paymentTotal);
    }
}
