package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.dto.ResponseCode;
import org.springframework.stereotype.Component;

/**
 * 포인트 사용 검증
 *
 * - 사용 포인트는 0 이상, 상품 합계 이하
 * - 회원이 직접 주문하는 경우 보유 포인트 이하
 */
@Component
public class PointUsageValidator extends AbstractOrderProcessor {

    @Override
    protected void processOrder(Order target, PurchaseContext context) {
        int usePoint = target.getUsePoint();
        if (usePoint < 0) {
            context.addError(ResponseCode.POINT_INVALID_AMOUNT, "사용 포인트는 0 이상이어야 합니다: " + usePoint);
            return;
        }
        if (usePoint > target.getItemsTotal().getAmount()) {
            context.addError(ResponseCode.POINT_INVALID_AMOUNT, "사용 포인트가 상품 합계를 초과합니다: " + usePoint);
        }
        if (context.getActor() instanceof CustomerActor customerActor
                && !customerActor.customer().hasPoint(usePoint)) {
            context.addError(ResponseCode.POINT_INSUFFICIENT,
                    "보유 포인트가 부족합니다: 보유 " + customerActor.customer().getPointBalance().getAmount()
                            + ", 사용 " + usePoint);
        }
    }
}
