package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.entity.ItemHolder;
import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseProcessor;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.PurchaseFlowFaultException;

/**
 * 주문에만 적용되는 프로세서의 기본 클래스
 *
 * 주문이 아닌 대상이 들어오면 플로우 구성 오류이므로 처리를 중단합니다.
 */
public abstract class AbstractOrderProcessor implements PurchaseProcessor {

    @Override
    public final void process(ItemHolder target, PurchaseContext context) {
        processOrder(requireOrder(target), context);
    }

    protected abstract void processOrder(Order target, PurchaseContext context);

    protected Order requireOrder(ItemHolder holder) {
        if (holder instanceof Order order) {
            return order;
        }
        throw new PurchaseFlowFaultException(ResponseCode.FLOW_UNSUPPORTED_HOLDER,
                getClass().getSimpleName() + "는 주문만 처리할 수 있습니다: " + holder.getClass().getSimpleName());
    }
}
