package com.purchaseflow.domain.purchase;

import com.purchaseflow.domain.entity.ItemHolder;

/**
 * 구매 플로우의 업무 규칙 하나
 *
 * 구현체는 다음을 지켜야 합니다.
 * - 변경은 target에만 한다. context의 원본(origin)은 읽기 전용이다.
 * - 오류/경고는 {@link PurchaseContext#addError}, {@link PurchaseContext#addWarning}으로 남긴다.
 * - 이미 확정된 주문에 여러 번 실행해도, 실제 상태 변화가 없으면 기록된 값을 바꾸지 않는다.
 * - 처리를 계속할 수 없으면 {@link com.purchaseflow.exception.PurchaseFlowFaultException}을 던진다.
 */
public interface PurchaseProcessor {

    void process(ItemHolder target, PurchaseContext context);
}
