package com.purchaseflow.application.dto;

import com.purchaseflow.domain.purchase.PurchaseMessage;
import com.purchaseflow.domain.purchase.PurchasePhase;

import java.util.List;

/**
 * 주문 처리 결과
 *
 * @param orderId 저장된 주문 ID (실패한 신규 주문은 null)
 * @param success 모든 단계가 성공하여 저장되었는지 여부
 * @param failedPhase 실패한 단계 (성공 시 null)
 */
public record OrderProcessResponse(
        Long orderId,
        boolean success,
        PurchasePhase failedPhase,
        List<PurchaseMessage> errors,
        List<PurchaseMessage> warnings
) {
}
